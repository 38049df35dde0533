module com.perpclear.runner {
    // Internal modules
    requires com.perpclear.clearing;

    // Data/IO
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.perpclear.runner;

    // Jackson reflection access
    opens com.perpclear.runner to com.fasterxml.jackson.databind;
}
