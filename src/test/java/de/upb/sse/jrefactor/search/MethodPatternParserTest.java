package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.exceptions.MalformedPatternException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class MethodPatternParserTest {

    @Test
    @DisplayName("Target type, method name and parameters are split apart")
    public void parse_pattern() {
        MethodPattern pattern = MethodPatternParser.parse("com.foo..*Service find*(String, int[], ..)");

        assertEquals("com.foo..*Service", pattern.getTargetTypePattern());
        assertEquals("find*", pattern.getMethodNamePattern());
        assertEquals(3, pattern.getParams().size());
        assertEquals("String", ((MethodPattern.FormalType) pattern.getParams().get(0)).getTypePattern());
        assertEquals("int[]", ((MethodPattern.FormalType) pattern.getParams().get(1)).getTypePattern());
        assertSame(MethodPattern.DotDot.INSTANCE, pattern.getParams().get(2));
    }

    @Test
    @DisplayName("Empty parameter list and surrounding whitespace")
    public void parse_no_params() {
        MethodPattern pattern = MethodPatternParser.parse("  java.lang.Object   hashCode( )  ");

        assertEquals("java.lang.Object", pattern.getTargetTypePattern());
        assertTrue(pattern.getParams().isEmpty());
    }

    @Test
    @DisplayName("Trailing ellipsis marks a varargs parameter")
    public void parse_varargs() {
        MethodPattern pattern = MethodPatternParser.parse("java.lang.String format(String, Object...)");

        MethodPattern.FormalType varargs = (MethodPattern.FormalType) pattern.getParams().get(1);
        assertTrue(varargs.isVarargs());
        assertEquals("Object", varargs.getTypePattern());
        assertEquals("Object...", varargs.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "java.util.List add",
            "java.util.List add(..",
            "java.util.List add(..))",
            "add(..)",
            "java.util.List add extra(..)",
            "java.util.List add(.., ..)",
            "java.util.List add(int,)",
            "java.util.List a-b(..)",
            "java.util..List. add(..)",
            "java.util.List add(int...[])"
    })
    @DisplayName("Malformed patterns are rejected")
    public void malformed(String signature) {
        MalformedPatternException e = assertThrows(MalformedPatternException.class, () -> MethodPatternParser.parse(signature));
        assertEquals(signature, e.getSignature());
    }

    @Test
    @DisplayName("Null pattern is rejected")
    public void malformed_null() {
        assertThrows(MalformedPatternException.class, () -> MethodPatternParser.parse(null));
    }
}
