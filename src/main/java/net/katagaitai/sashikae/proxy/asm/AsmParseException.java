package net.katagaitai.sashikae.proxy.asm;

public class AsmParseException extends Exception {
    public AsmParseException(String message) {
        super(message);
    }
}
