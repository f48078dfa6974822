package de.upb.sse.jrefactor.search;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Parsed form of a method pattern, before regex emission.
 *
 * Names keep their wildcards ({@code *} and {@code ..}) as written.
 */
@Getter
@ToString
@AllArgsConstructor
public class MethodPattern {
    private final String targetTypePattern;
    private final String methodNamePattern;
    private final List<Param> params;

    public abstract static class Param {
        private Param() {
        }
    }

    /**
     * Zero or more parameters of any type.
     */
    public static final class DotDot extends Param {
        public static final DotDot INSTANCE = new DotDot();

        private DotDot() {
        }

        @Override
        public String toString() {
            return "..";
        }
    }

    @Getter
    public static final class FormalType extends Param {
        private final String typePattern;
        private final boolean varargs;

        public FormalType(String typePattern, boolean varargs) {
            this.typePattern = typePattern;
            this.varargs = varargs;
        }

        @Override
        public String toString() {
            return varargs ? typePattern + "..." : typePattern;
        }
    }
}
