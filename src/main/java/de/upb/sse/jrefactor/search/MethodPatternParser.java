package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.exceptions.MalformedPatternException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads {@code TargetTypePattern methodNamePattern(ParamPattern, ...)} into a {@link MethodPattern}.
 *
 * Type names are dot separated identifiers that may contain {@code *} and use {@code ..} between
 * segments. A parameter is either such a type name, optionally followed by {@code []} pairs or a
 * trailing {@code ...}, or the {@code ..} token, which may appear at most once.
 */
public class MethodPatternParser {
    private static final Pattern TYPE_NAME = Pattern.compile("[\\w$*]+(\\.{1,2}[\\w$*]+)*(\\[])*");
    private static final Pattern METHOD_NAME = Pattern.compile("[\\w$*]+");

    public static MethodPattern parse(String signature) {
        if (signature == null) throw new MalformedPatternException(null, "pattern is null");

        String trimmed = signature.trim();
        int open = trimmed.indexOf('(');
        if (open < 0 || !trimmed.endsWith(")") || trimmed.indexOf(')') != trimmed.length() - 1) {
            throw new MalformedPatternException(signature, "expected a parameter list in parentheses at the end");
        }

        String[] head = trimmed.substring(0, open).trim().split("\\s+");
        if (head.length != 2) {
            throw new MalformedPatternException(signature, "expected a target type and a method name");
        }

        String targetType = head[0];
        String methodName = head[1];
        if (!TYPE_NAME.matcher(targetType).matches()) {
            throw new MalformedPatternException(signature, "invalid target type '" + targetType + "'");
        }
        if (!METHOD_NAME.matcher(methodName).matches()) {
            throw new MalformedPatternException(signature, "invalid method name '" + methodName + "'");
        }

        return new MethodPattern(targetType, methodName, parseParams(signature, trimmed.substring(open + 1, trimmed.length() - 1)));
    }

    private static List<MethodPattern.Param> parseParams(String signature, String paramList) {
        List<MethodPattern.Param> params = new ArrayList<>();
        if (paramList.trim().isEmpty()) return params;

        boolean seenDotDot = false;
        for (String token : paramList.split(",", -1)) {
            String param = token.trim();
            if (param.equals("..")) {
                if (seenDotDot) {
                    throw new MalformedPatternException(signature, "'..' may appear only once in the parameter list");
                }
                seenDotDot = true;
                params.add(MethodPattern.DotDot.INSTANCE);
                continue;
            }

            boolean varargs = param.endsWith("...");
            String typeName = varargs ? param.substring(0, param.length() - 3) : param;
            if (!TYPE_NAME.matcher(typeName).matches()) {
                throw new MalformedPatternException(signature, "invalid parameter type '" + param + "'");
            }
            params.add(new MethodPattern.FormalType(typeName, varargs));
        }
        return params;
    }
}
