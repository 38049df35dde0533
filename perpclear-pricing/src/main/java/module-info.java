module com.perpclear.pricing {
    // Exports
    exports com.perpclear.pricing;

    // Dependencies
    requires transitive com.perpclear.core;
    requires org.slf4j;
}
