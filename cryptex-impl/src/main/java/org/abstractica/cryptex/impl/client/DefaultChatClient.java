package org.abstractica.cryptex.impl.client;

import org.abstractica.cryptex.ChatClient;
import org.abstractica.cryptex.ConnectionFailedException;
import org.abstractica.cryptex.DisconnectReason;
import org.abstractica.cryptex.Identities;
import org.abstractica.cryptex.RejectReason;
import org.abstractica.cryptex.SessionState;
import org.abstractica.cryptex.handlers.ChatListener;
import org.abstractica.cryptex.impl.crypto.ConversationKey;
import org.abstractica.cryptex.impl.crypto.CryptoException;
import org.abstractica.cryptex.impl.crypto.KeyWrapper;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.crypto.SealedMessage;
import org.abstractica.cryptex.impl.crypto.Signer;
import org.abstractica.cryptex.impl.protocol.Direction;
import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.protocol.KeyScope;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;
import org.abstractica.cryptex.impl.protocol.ProtocolException;
import org.abstractica.cryptex.impl.protocol.UserListCodec;
import org.abstractica.cryptex.impl.transport.FramedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of the ChatClient interface.
 *
 * <p>Owns the RSA key pair and the {@link PeerKeyring} of one session. After
 * authentication a dedicated receive thread processes directory updates,
 * session keys and messages; callers send from their own threads.</p>
 *
 * <p>Conversation keys are established lazily: the first message to a peer is
 * preceded by a SESSION_KEY envelope carrying a fresh key wrapped with the
 * peer's public key and signed with this client's private key.</p>
 */
public class DefaultChatClient implements ChatClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultChatClient.class);

    private final String host;
    private final int port;
    private final String identity;
    private final int rsaKeySize;
    private final Duration connectTimeout;
    private final Duration authTimeout;
    private final int maxEnvelopeSize;

    private final List<ChatListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);
    private final PeerKeyring keyring = new PeerKeyring();
    private final ReentrantLock sendLock = new ReentrantLock();

    private volatile FramedConnection connection;
    private volatile KeyPair keyPair;
    private volatile DisconnectReason disconnectReason;
    private volatile List<String> onlineIdentities = List.of();
    private Thread receiveThread;

    DefaultChatClient(
            String host,
            int port,
            String identity,
            int rsaKeySize,
            Duration connectTimeout,
            Duration authTimeout,
            int maxEnvelopeSize,
            List<ChatListener> listeners)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.rsaKeySize = rsaKeySize;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.authTimeout = Objects.requireNonNull(authTimeout, "authTimeout");
        this.maxEnvelopeSize = maxEnvelopeSize;
        this.listeners.addAll(listeners);
    }

    // ========== Connection ==========

    @Override
    public void connect() throws ConnectionFailedException
    {
        if (!state.compareAndSet(SessionState.DISCONNECTED, SessionState.AUTHENTICATING))
        {
            throw new IllegalStateException("connect() already called (state " + state.get() + ")");
        }

        Optional<String> invalid = Identities.validate(identity);
        if (invalid.isPresent())
        {
            throw fail(new DisconnectReason.Rejected(RejectReason.INVALID_IDENTITY, invalid.get()), null);
        }

        LOG.info("Connecting to {}:{} as {}", host, port, identity);
        keyPair = RsaKeys.generateKeyPair(rsaKeySize);

        Socket socket = new Socket();
        try
        {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            socket.setTcpNoDelay(true);
            connection = new FramedConnection(socket, Direction.DOWNSTREAM, maxEnvelopeSize);
        }
        catch (SocketTimeoutException e)
        {
            closeQuietly(socket);
            throw fail(new DisconnectReason.Timeout(), e);
        }
        catch (IOException e)
        {
            closeQuietly(socket);
            throw fail(new DisconnectReason.NetworkError(e), e);
        }

        authenticate();

        if (!state.compareAndSet(SessionState.AUTHENTICATED, SessionState.ACTIVE))
        {
            throw new ConnectionFailedException(getDisconnectReason().orElse(new DisconnectReason.ClosedByClient()));
        }

        receiveThread = new Thread(this::receiveLoop, "cryptex-client-" + identity);
        receiveThread.setDaemon(true);
        receiveThread.start();

        LOG.info("Connected as {}", identity);
        for (ChatListener listener : listeners)
        {
            safeCallback(() -> listener.onConnectionState(true, "Connected as " + identity));
        }
    }

    private void authenticate() throws ConnectionFailedException
    {
        String pem = RsaKeys.exportPublicKey(keyPair.getPublic());

        Optional<Envelope> reply;
        try
        {
            connection.send(Envelope.auth(identity, pem));
            connection.setReadTimeout(authTimeout);
            reply = connection.receiveStrict();
        }
        catch (SocketTimeoutException e)
        {
            throw fail(new DisconnectReason.Timeout(), e);
        }
        catch (IOException e)
        {
            throw fail(new DisconnectReason.NetworkError(e), e);
        }
        catch (ProtocolException e)
        {
            throw fail(new DisconnectReason.ProtocolError(e.getMessage()), e);
        }

        if (reply.isEmpty())
        {
            throw fail(new DisconnectReason.ProtocolError("Connection closed during authentication"), null);
        }

        Envelope envelope = reply.get();
        switch (envelope.type())
        {
            case AUTH_ACCEPTED:
                break;
            case AUTH_REJECTED:
                throw fail(toRejection(envelope), null);
            case DISCONNECT:
                throw fail(new DisconnectReason.ServerShutdown(envelope.field(0)), null);
            default:
                throw fail(new DisconnectReason.ProtocolError(
                        "Unexpected " + envelope.type() + " during authentication"), null);
        }

        try
        {
            connection.setReadTimeout(Duration.ZERO);
        }
        catch (IOException e)
        {
            throw fail(new DisconnectReason.NetworkError(e), e);
        }
        state.compareAndSet(SessionState.AUTHENTICATING, SessionState.AUTHENTICATED);
    }

    private static DisconnectReason toRejection(Envelope envelope)
    {
        try
        {
            RejectReason reason = RejectReason.fromCode(Integer.parseInt(envelope.field(0)));
            return new DisconnectReason.Rejected(reason, envelope.field(1));
        }
        catch (IllegalArgumentException e)
        {
            return new DisconnectReason.ProtocolError("Invalid rejection code: " + envelope.field(0));
        }
    }

    private ConnectionFailedException fail(DisconnectReason reason, Throwable cause)
    {
        LOG.warn("Connection failed: {}", reason.describe());
        end(reason);
        DisconnectReason effective = getDisconnectReason().orElse(reason);
        return cause != null
                ? new ConnectionFailedException(effective, cause)
                : new ConnectionFailedException(effective);
    }

    @Override
    public void disconnect()
    {
        SessionState current = state.get();
        if (current == SessionState.CLOSED)
        {
            return;
        }
        if (current == SessionState.DISCONNECTED && state.compareAndSet(SessionState.DISCONNECTED, SessionState.CLOSED))
        {
            disconnectReason = new DisconnectReason.ClosedByClient();
            return;
        }

        LOG.info("Disconnecting");
        FramedConnection conn = connection;
        if (conn != null && current == SessionState.ACTIVE)
        {
            try
            {
                conn.send(Envelope.disconnect());
            }
            catch (IOException e)
            {
                LOG.debug("Could not send DISCONNECT: {}", e.getMessage());
            }
        }
        end(new DisconnectReason.ClosedByClient());

        Thread receiver = receiveThread;
        if (receiver != null && receiver != Thread.currentThread())
        {
            try
            {
                receiver.join(1000);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close()
    {
        disconnect();
    }

    /**
     * Moves to CLOSED exactly once, closes the socket and notifies listeners if a session was up.
     */
    private void end(DisconnectReason reason)
    {
        SessionState previous = state.getAndSet(SessionState.CLOSED);
        if (previous == SessionState.CLOSED)
        {
            return;
        }

        disconnectReason = reason;
        FramedConnection conn = connection;
        if (conn != null)
        {
            conn.close();
        }

        if (previous != SessionState.DISCONNECTED)
        {
            LOG.info("Session ended: {}", reason.describe());
            for (ChatListener listener : listeners)
            {
                safeCallback(() -> listener.onConnectionState(false, reason.describe()));
            }
        }
    }

    // ========== Receiving ==========

    private void receiveLoop()
    {
        LOG.debug("Receive loop started");
        try
        {
            while (state.get() == SessionState.ACTIVE)
            {
                Optional<Envelope> next = connection.receive();
                if (next.isEmpty())
                {
                    end(new DisconnectReason.ServerShutdown(""));
                    break;
                }
                if (!dispatch(next.get()))
                {
                    break;
                }
            }
        }
        catch (IOException e)
        {
            end(new DisconnectReason.NetworkError(e));
        }
        catch (ProtocolException e)
        {
            end(new DisconnectReason.ProtocolError(e.getMessage()));
        }
        catch (RuntimeException e)
        {
            LOG.error("Error in receive loop", e);
            end(new DisconnectReason.ProtocolError(e.toString()));
        }
        LOG.debug("Receive loop stopped");
    }

    /**
     * Handles one envelope from the relay.
     *
     * @return false if the relay ended the session
     */
    private boolean dispatch(Envelope envelope)
    {
        switch (envelope.type())
        {
            case USER_LIST:
                handleUserList(envelope.field(0));
                return true;
            case KEY_EXCHANGE:
                handleKeyExchange(envelope.field(0), envelope.field(1));
                return true;
            case SESSION_KEY:
                handleSessionKey(envelope);
                return true;
            case MESSAGE:
                handleMessage(envelope, KeyScope.DIRECT);
                return true;
            case BROADCAST:
                handleMessage(envelope, KeyScope.BROADCAST);
                return true;
            case DISCONNECT:
                LOG.info("Relay closed the session: {}", envelope.field(0));
                end(new DisconnectReason.ServerShutdown(envelope.field(0)));
                return false;
            default:
                LOG.warn("Ignoring unexpected {} from relay", envelope.type());
                return true;
        }
    }

    private void handleUserList(String json)
    {
        List<String> identities;
        try
        {
            identities = UserListCodec.decode(json);
        }
        catch (ProtocolException e)
        {
            LOG.warn("Ignoring user list: {}", e.getMessage());
            return;
        }

        onlineIdentities = identities;
        keyring.retainOnly(identities);
        for (ChatListener listener : listeners)
        {
            safeCallback(() -> listener.onDirectoryChanged(identities));
        }
    }

    private void handleKeyExchange(String peer, String pem)
    {
        if (peer.equals(identity))
        {
            LOG.debug("Ignoring own public key");
            return;
        }
        try
        {
            if (keyring.updatePublicKey(peer, pem))
            {
                LOG.debug("Received public key of {}", peer);
            }
        }
        catch (CryptoException e)
        {
            LOG.warn("Invalid public key for {}: {}", peer, e.getMessage());
            reportError("Received an invalid public key for " + peer);
        }
    }

    private void handleSessionKey(Envelope envelope)
    {
        String sender = envelope.field(0);
        Optional<KeyScope> scope = KeyScope.fromWire(envelope.field(1));
        String wrapped = envelope.field(2);
        String signature = envelope.field(3);

        Optional<PublicKey> senderKey = keyring.publicKey(sender);
        if (scope.isEmpty() || senderKey.isEmpty())
        {
            LOG.warn("Ignoring session key from {} (scope {}, key known: {})",
                    sender, envelope.field(1), senderKey.isPresent());
            reportError("Could not establish a secure session with " + sender);
            return;
        }

        try
        {
            byte[] signed = signedSessionKey(sender, identity, scope.get(), wrapped);
            if (!Signer.verify(signed, Base64.getDecoder().decode(signature), senderKey.get()))
            {
                LOG.warn("Session key from {} has an invalid signature", sender);
                reportError("Rejected a session key from " + sender + ": invalid signature");
                return;
            }
            byte[] master = KeyWrapper.unwrap(Base64.getDecoder().decode(wrapped), keyPair.getPrivate());
            keyring.storeInbound(sender, scope.get(), ConversationKey.fromMaster(master));
            LOG.debug("Established {} session key from {}", scope.get(), sender);
        }
        catch (IllegalArgumentException e)
        {
            LOG.warn("Malformed session key from {}: {}", sender, e.getMessage());
            reportError("Could not establish a secure session with " + sender);
        }
        catch (CryptoException e)
        {
            LOG.warn("Could not unwrap session key from {}: {}", sender, e.getMessage());
            reportError("Could not establish a secure session with " + sender);
        }
    }

    private void handleMessage(Envelope envelope, KeyScope scope)
    {
        String sender = envelope.field(0);
        SealedMessage sealed = new SealedMessage(envelope.field(1), envelope.field(2));

        Optional<ConversationKey> key = keyring.inbound(sender, scope);
        if (key.isEmpty())
        {
            LOG.warn("No {} session key from {}", scope, sender);
            reportError("Could not decrypt message from " + sender);
            return;
        }

        String text;
        try
        {
            text = key.get().open(sealed);
        }
        catch (CryptoException e)
        {
            LOG.warn("Dropping message from {}: {} ({})", sender, e.getMessage(), e.getReason());
            reportError("Could not decrypt message from " + sender);
            return;
        }

        boolean broadcast = scope == KeyScope.BROADCAST;
        for (ChatListener listener : listeners)
        {
            safeCallback(() -> listener.onMessage(sender, text, broadcast));
        }
    }

    // ========== Sending ==========

    @Override
    public boolean send(String recipient, String text)
    {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(text, "text");
        if (ProtocolConstants.EVERYONE.equals(recipient))
        {
            return broadcast(text);
        }
        requireActive();

        if (recipient.equals(identity))
        {
            reportError("Cannot send a message to yourself");
            return false;
        }

        sendLock.lock();
        try
        {
            Optional<PublicKey> recipientKey = keyring.publicKey(recipient);
            if (recipientKey.isEmpty())
            {
                reportError("No public key for " + recipient);
                return false;
            }

            Optional<ConversationKey> existing = keyring.outbound(recipient);
            ConversationKey key;
            if (existing.isPresent())
            {
                key = existing.get();
            }
            else
            {
                key = ConversationKey.generate();
                connection.send(sessionKeyEnvelope(recipient, KeyScope.DIRECT, key, recipientKey.get()));
                keyring.storeOutbound(recipient, key, recipientKey.get());
                LOG.debug("Sent session key to {}", recipient);
            }

            SealedMessage sealed = key.seal(text);
            connection.send(Envelope.messageTo(recipient, sealed.cipherText(), sealed.tag()));
            return true;
        }
        catch (CryptoException e)
        {
            LOG.warn("Could not establish session key with {}: {}", recipient, e.getMessage());
            reportError("Could not encrypt message for " + recipient);
            return false;
        }
        catch (IOException e)
        {
            LOG.warn("Send to {} failed: {}", recipient, e.getMessage());
            reportError("Failed to send message: " + e.getMessage());
            return false;
        }
        finally
        {
            sendLock.unlock();
        }
    }

    @Override
    public boolean broadcast(String text)
    {
        Objects.requireNonNull(text, "text");
        requireActive();

        sendLock.lock();
        try
        {
            ConversationKey key = keyring.broadcastKey();
            for (String peer : keyring.peersLackingBroadcastKey())
            {
                Optional<PublicKey> peerKey = keyring.publicKey(peer);
                if (peerKey.isEmpty())
                {
                    continue;
                }
                try
                {
                    connection.send(sessionKeyEnvelope(peer, KeyScope.BROADCAST, key, peerKey.get()));
                    keyring.markBroadcastKeySent(peer, peerKey.get());
                }
                catch (CryptoException e)
                {
                    LOG.warn("Could not share broadcast key with {}: {}", peer, e.getMessage());
                }
            }

            SealedMessage sealed = key.seal(text);
            connection.send(Envelope.broadcast(sealed.cipherText(), sealed.tag()));
            return true;
        }
        catch (IOException e)
        {
            LOG.warn("Broadcast failed: {}", e.getMessage());
            reportError("Failed to send message: " + e.getMessage());
            return false;
        }
        finally
        {
            sendLock.unlock();
        }
    }

    private Envelope sessionKeyEnvelope(String recipient, KeyScope scope, ConversationKey key, PublicKey recipientKey)
            throws CryptoException
    {
        String wrapped = Base64.getEncoder().encodeToString(KeyWrapper.wrap(key.master(), recipientKey));
        byte[] signature = Signer.sign(signedSessionKey(identity, recipient, scope, wrapped), keyPair.getPrivate());
        return Envelope.sessionKeyTo(recipient, scope, wrapped, Base64.getEncoder().encodeToString(signature));
    }

    /**
     * Bytes covered by a session key signature: sender, recipient, scope and wrapped key.
     */
    static byte[] signedSessionKey(String sender, String recipient, KeyScope scope, String wrappedKey)
    {
        String s = ProtocolConstants.SEPARATOR;
        return (sender + s + recipient + s + scope.name() + s + wrappedKey).getBytes(StandardCharsets.UTF_8);
    }

    private void requireActive()
    {
        if (state.get() != SessionState.ACTIVE)
        {
            throw new IllegalStateException("Not connected (state " + state.get() + ")");
        }
    }

    // ========== Accessors ==========

    @Override
    public void addListener(ChatListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public String getIdentity()
    {
        return identity;
    }

    @Override
    public SessionState getState()
    {
        return state.get();
    }

    @Override
    public List<String> getOnlineIdentities()
    {
        return onlineIdentities;
    }

    @Override
    public Optional<DisconnectReason> getDisconnectReason()
    {
        return Optional.ofNullable(disconnectReason);
    }

    PeerKeyring getKeyring()
    {
        return keyring;
    }

    // ========== Helpers ==========

    private void reportError(String message)
    {
        for (ChatListener listener : listeners)
        {
            safeCallback(() -> listener.onError(message));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Listener error", e);
        }
    }

    private static void closeQuietly(Socket socket)
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
