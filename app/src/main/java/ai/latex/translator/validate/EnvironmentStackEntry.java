package ai.latex.translator.validate;

import java.util.Objects;

record EnvironmentStackEntry(String name, int line, int column) {

    EnvironmentStackEntry {
        Objects.requireNonNull(name, "name");
    }
}
