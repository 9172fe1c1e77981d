package com.truthy.processor;

import java.util.Map;
import java.util.Set;

/**
 * 处理器配置，来自 {@code -A} 选项
 */
public class ProcessorConfig {

    public static final String VERBOSE = "truthy.verbose";
    public static final String GENERATED_ANNOTATION = "truthy.generatedAnnotation";
    public static final String CALL_NAME = "truthy.callName";

    public static final Set<String> OPTIONS = Set.of(VERBOSE, GENERATED_ANNOTATION, CALL_NAME);

    private boolean verbose = false;
    private boolean generatedAnnotation = true;
    private String callName = "truthy";

    public ProcessorConfig() {
    }

    public static ProcessorConfig fromOptions(Map<String, String> options) {
        ProcessorConfig config = new ProcessorConfig();
        String verbose = options.get(VERBOSE);
        if (verbose != null) {
            config.setVerbose(Boolean.parseBoolean(verbose));
        }
        String generated = options.get(GENERATED_ANNOTATION);
        if (generated != null) {
            config.setGeneratedAnnotation(Boolean.parseBoolean(generated));
        }
        String callName = options.get(CALL_NAME);
        if (callName != null && !callName.isBlank()) {
            config.setCallName(callName.trim());
        }
        return config;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isGeneratedAnnotation() {
        return generatedAnnotation;
    }

    public void setGeneratedAnnotation(boolean generatedAnnotation) {
        this.generatedAnnotation = generatedAnnotation;
    }

    public String getCallName() {
        return callName;
    }

    public void setCallName(String callName) {
        this.callName = callName;
    }
}
