package net.katagaitai.sashikae.model.type;

public abstract class Type {
    public abstract <R> R accept(TypeVisitor<R> visitor);
}
