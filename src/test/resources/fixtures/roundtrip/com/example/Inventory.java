/*
 * Header comment that is not a license.
 */
package com.example;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import static java.util.Objects.requireNonNull;

/**
 * Javadoc on the type.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class Inventory<T extends Comparable<T>> implements Iterable<T> {
    private static final long serialVersionUID = 1L;
    private final List<T> items = new ArrayList<>();
    protected int a, b = 2;
    int[] counts = {1, 2, 3};
    static String NAME;

    static {
        NAME = "inventory";
    }

    {
        a = 1;
    }

    public Inventory() {
        super();
    }

    /** Adds an item. */
    @Deprecated
    public  boolean add( T item )  {
        requireNonNull(item, "item");
        return items.add(item);
    }

    public <R> List<R> map(Function<? super T, ? extends R> fn) {
        List<R> result = new ArrayList<>(items.size());
        for (T item : items) {
            result.add(fn.apply(item));
        }
        return result;
    }

    public int sum(int... values) {
        int total = 0;
        for (int i = 0; i < values.length; i++) total += values[i];
        return total;
    }

    void chained() throws Exception, RuntimeException {
        String s = String.valueOf(1).trim() .toUpperCase(/* nothing */);
        Map<String, Integer> m = java.util.Collections.<String, Integer>emptyMap();
        Runnable r = () -> System.out.println("lambda");
        Function<Integer, Integer> inc = x -> x + 1;
        r.run();
        Object o = (Object) s;
        boolean isString = o instanceof String ? true : false;
        int  n = ( (1 + 2) * 3 );
        this.a = n;
        a += 4;
        a++;
        label:
        while (a > 0) {
            if (a == 2) break label;
            a--;
        }
        try (java.io.StringReader reader = new java.io.StringReader(s)) {
            reader.read();
        } catch (java.io.IOException | IllegalStateException e) {
            throw new RuntimeException(e);
        } finally {
            ;
        }
        new Thread(new Runnable() {
            @Override
            public void run() {
                chained2();
            }
        }).start();
    }

    private void chained2() {
    }

    @Override
    public java.util.Iterator<T> iterator() {
        return items.iterator();
    } // trailing comment
}
