package org.carball.recon.model.field;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable list of canonical fields. Iteration order is the order fields were supplied in,
 * and mapping results follow it.
 */
public final class CanonicalFieldRegistry {

    private final List<CanonicalField> fields;

    public CanonicalFieldRegistry(List<CanonicalField> fields) {
        Set<String> names = new HashSet<>();
        for (CanonicalField field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate canonical field: " + field.name());
            }
        }
        this.fields = List.copyOf(new ArrayList<>(fields));
    }

    public List<CanonicalField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }
}
