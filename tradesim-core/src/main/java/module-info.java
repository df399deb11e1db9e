module com.tradesim.core {
    // Exports
    exports com.tradesim.core.model;
    exports com.tradesim.core.exception;

    // Jackson (for settings and model serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires org.slf4j;

    // Jackson needs reflection access to models
    opens com.tradesim.core.model to com.fasterxml.jackson.databind;
}
