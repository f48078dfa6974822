package de.upb.sse.jrefactor.ast;

/**
 * Modifier flags carried by {@link Type.Method} and {@link Type.Var}.
 */
public enum Flag {
    Public, Private, Protected, Static, Final, Synchronized, Volatile, Transient, Abstract, Native, Default;

    public static Flag fromKeyword(String keyword) {
        for (Flag flag : values()) {
            if (flag.name().toLowerCase().equals(keyword)) return flag;
        }
        return null;
    }
}
