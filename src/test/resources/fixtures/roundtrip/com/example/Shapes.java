package com.example;

import java.util.*;

public interface Shapes {
    double area();

    default String describe() {
        return "area " + area();
    }

    static Shapes unit() {
        return () -> 1.0;
    }
}

enum Color {
    RED("r"),
    GREEN("g") {
        @Override
        String code() {
            return "G";
        }
    },
    BLUE("b");

    private final String code;

    Color(String code) {
        this.code = code;
    }

    String code() {
        return code;
    }
}

enum Empty { }

enum Plain { ONE, TWO, }

@interface Marker {
    String value() default "";
    int[] numbers() default {};
}

record Point(int x, int y) implements Comparable<Point> {
    Point {
        if (x < 0) throw new IllegalArgumentException();
    }

    static Point origin() {
        return new Point(0, 0);
    }

    @Override
    public int compareTo(Point other) {
        return Integer.compare(x, other.x);
    }
}

abstract sealed class Animal permits Dog {
    abstract String sound();
}

final class Dog extends Animal {
    String sound() {
        String text = """
            woof
              "woof"
            """;
        return switch (text.length()) {
            case 0 -> "";
            default -> {
                yield text;
            }
        };
    }
}
