module com.tradesim.data {
    exports com.tradesim.data;

    requires transitive com.tradesim.engine;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires org.slf4j;

    opens com.tradesim.data to com.fasterxml.jackson.databind;
}
