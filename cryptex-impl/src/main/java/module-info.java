/**
 * Cryptex implementation module.
 *
 * <p>Provides the socket relay, the chat client and the hybrid crypto engine
 * behind the {@code cryptex.api} interfaces.</p>
 */
module cryptex.impl
{
    requires cryptex.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;

    // Factory implementations
    exports org.abstractica.cryptex.impl.client;
    exports org.abstractica.cryptex.impl.relay;
    exports org.abstractica.cryptex.impl.audit;

    // Engine and wire format, for tools that speak the protocol directly
    exports org.abstractica.cryptex.impl.crypto;
    exports org.abstractica.cryptex.impl.protocol;
    exports org.abstractica.cryptex.impl.transport;
}
