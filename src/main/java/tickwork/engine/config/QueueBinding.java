package tickwork.engine.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered, duplicate-free set of queue names a worker process polls.
 * Order is priority: earlier queues are drained first.
 */
public final class QueueBinding implements Iterable<String> {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_.:-]{1,128}");

    private final List<String> queues;

    private QueueBinding(List<String> queues) {
        this.queues = Collections.unmodifiableList(queues);
    }

    /**
     * Parse a space or comma separated list, e.g. {@code "queries periodic default"}.
     * Duplicates are dropped keeping the first occurrence.
     */
    public static QueueBinding parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("queue binding is empty");
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : SEPARATORS.split(value.trim())) {
            if (!name.isEmpty()) {
                names.add(validateName(name));
            }
        }
        return new QueueBinding(new ArrayList<>(names));
    }

    public static QueueBinding of(String... names) {
        return parse(String.join(" ", names));
    }

    public static String validateName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid queue name: '" + name + "'");
        }
        return name;
    }

    public List<String> names() {
        return queues;
    }

    public boolean contains(String queue) {
        return queues.contains(queue);
    }

    public int size() {
        return queues.size();
    }

    @Override
    public Iterator<String> iterator() {
        return queues.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueueBinding that))
            return false;
        return queues.equals(that.queues);
    }

    @Override
    public int hashCode() {
        return queues.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", queues);
    }
}
