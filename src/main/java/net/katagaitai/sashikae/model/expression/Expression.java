package net.katagaitai.sashikae.model.expression;

public abstract class Expression {
}
