module com.perpclear.core {
    // Exports
    exports com.perpclear.core.math;
    exports com.perpclear.core.exception;
    exports com.perpclear.core.oracle;
    exports com.perpclear.core.access;
    exports com.perpclear.core.time;
    exports com.perpclear.core.config;

    // Dependencies
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires transitive org.slf4j;

    // Jackson needs reflection access to config beans
    opens com.perpclear.core.config to com.fasterxml.jackson.databind;
}
