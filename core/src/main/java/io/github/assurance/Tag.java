package io.github.assurance;

/**
 * Diagnostic label of a detector, used for logging and attribution only.
 *
 * @param module owning module, e.g. "qos_controller"
 * @param name detector or signal name
 */
public record Tag(String module, String name) {

    public Tag {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("Tag module cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be null or blank");
        }
    }

    public static Tag of(String module, String name) {
        return new Tag(module, name);
    }

    @Override
    public String toString() {
        return module + "/" + name;
    }
}
