/**
 * Cryptex API module.
 *
 * <p>Provides the interfaces for running a chat relay and connecting peers
 * to it with end-to-end encrypted messaging.</p>
 */
module cryptex.api
{
    exports org.abstractica.cryptex;
    exports org.abstractica.cryptex.handlers;
}
