module com.perpclear.clearing {
    // Exports
    exports com.perpclear.clearing;
    exports com.perpclear.clearing.journal;
    exports com.perpclear.clearing.paper;
    exports com.perpclear.clearing.port;
    exports com.perpclear.clearing.position;
    exports com.perpclear.clearing.risk;
    exports com.perpclear.clearing.tx;

    // Dependencies
    requires transitive com.perpclear.pricing;
    requires transitive com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires org.slf4j;

    // Jackson needs reflection access to journal events
    opens com.perpclear.clearing.journal to com.fasterxml.jackson.databind;
}
