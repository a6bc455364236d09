package org.carball.recon.model.field;

import java.util.List;
import java.util.Objects;

public record CanonicalField(String name, List<String> aliases) {

    public CanonicalField {
        Objects.requireNonNull(name, "name");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
