package com.truthy.processor.fixtures;

import truthy.annotation.TruthyExpr;
import truthy.annotation.TruthyPredicate;

/**
 * 三个布尔变量上的各种语法形式
 */
@TruthyPredicate
public interface Chains {

    @TruthyExpr("a && b && c")
    boolean allOf(boolean a, boolean b, boolean c);

    @TruthyExpr("a || b && c")
    boolean orThenAnd(boolean a, boolean b, boolean c);

    @TruthyExpr("a && b || c")
    boolean andThenOr(boolean a, boolean b, boolean c);

    @TruthyExpr("(a && b) || c")
    boolean grouped(boolean a, boolean b, boolean c);

    @TruthyExpr("!a && b || c")
    boolean negatedChain(boolean a, boolean b, boolean c);

    @TruthyExpr("!(a) && !(b || c)")
    boolean negatedGroups(boolean a, boolean b, boolean c);

    @TruthyPredicate
    interface Inner {
        @TruthyExpr("!s")
        boolean blank(CharSequence s);
    }
}
