package io.github.drompincen.annostore.runtime.container;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dotted field paths occurring in an annotation, e.g. {@code body}, {@code body.type}.
 * Objects inside arrays contribute their paths under the array's own path.
 */
public final class FieldPaths {

    private FieldPaths() {}

    public static Set<String> of(Map<String, ?> annotation) {
        Set<String> paths = new TreeSet<>();
        collect("", annotation, paths);
        return paths;
    }

    private static void collect(String prefix, Map<?, ?> object, Set<String> paths) {
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String path = prefix + entry.getKey();
            paths.add(path);
            descend(path, entry.getValue(), paths);
        }
    }

    private static void descend(String path, Object value, Set<String> paths) {
        if (value instanceof Map<?, ?> nested) {
            collect(path + ".", nested, paths);
        } else if (value instanceof Collection<?> elements) {
            elements.forEach(element -> descend(path, element, paths));
        }
    }
}
