package de.upb.sse.jrefactor.exceptions;

/**
 * Thrown when a method pattern does not follow {@code TargetType methodName(ParamTypes)}.
 */
public class MalformedPatternException extends IllegalArgumentException {
    private final String signature;

    public MalformedPatternException(String signature, String reason) {
        super("Malformed method pattern '" + signature + "': " + reason);
        this.signature = signature;
    }

    public String getSignature() {
        return signature;
    }
}
