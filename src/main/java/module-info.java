module com.sparrowwallet.ballast {
    requires com.google.gson;
    requires com.google.common;
    requires org.slf4j;
    exports com.sparrowwallet.ballast;
    exports com.sparrowwallet.ballast.io;
    exports com.sparrowwallet.ballast.protocol;
    exports com.sparrowwallet.ballast.mempool;
    exports com.sparrowwallet.ballast.eviction;
    opens com.sparrowwallet.ballast.io;
}
