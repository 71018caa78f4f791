package com.bashnorm.tree;

/** Side from which a unary logic operator adopts its operand. */
public enum Associativity {
    LEFT,
    RIGHT
}
