package com.truthy.processor.codegen;

import com.truthy.processor.ast.Identifier;

/**
 * 无法为表达式中的标识符确定真值判定：参数不存在，或参数类型没有真值规则
 */
public class ResolutionException extends RuntimeException {
    private final Identifier identifier;

    /**
     * @param identifier 出错的标识符，消息末尾附上它在表达式中的位置
     */
    public ResolutionException(String reason, Identifier identifier) {
        super(reason + " at " + identifier.getPosition().describe());
        this.identifier = identifier;
    }

    public Identifier getIdentifier() {
        return identifier;
    }
}
