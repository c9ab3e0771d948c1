/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * @author kafle
 */
public class Util {

    /**
     * Cartesian product of the given lists, the last position varying
     * fastest. The product of no lists has exactly one empty tuple.
     */
    public static <T> List<List<T>> product(List<? extends List<? extends T>> choices) {
        List<List<T>> tuples = new ArrayList<>();
        tuples.add(Collections.<T>emptyList());
        for (List<? extends T> choice : choices) {
            List<List<T>> extended = new ArrayList<>(tuples.size() * choice.size());
            for (List<T> prefix : tuples) {
                for (T element : choice) {
                    List<T> tuple = new ArrayList<>(prefix.size() + 1);
                    tuple.addAll(prefix);
                    tuple.add(element);
                    extended.add(tuple);
                }
            }
            tuples = extended;
        }
        return tuples;
    }

    public static String join(List<?> elements, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i != 0) {
                sb.append(separator);
            }
            sb.append(elements.get(i));
        }
        return sb.toString();
    }
}
