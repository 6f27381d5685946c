package org.abstractica.cryptex.impl.relay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authoritative identity to connection map of the relay.
 *
 * <p>All access goes through one reentrant lock. Compound actions, such as
 * registering a peer and announcing it to everyone, run inside
 * {@link #exclusive(Runnable)} so no other registration or removal interleaves.</p>
 */
public class SessionDirectory
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DirectoryEntry> entries = new LinkedHashMap<>();

    // ========== Registration ==========

    /**
     * Registers an entry unless its identity is already taken.
     *
     * @param entry the entry
     * @return true if registered; false if the identity is in use
     */
    public boolean tryRegister(DirectoryEntry entry)
    {
        Objects.requireNonNull(entry, "entry");
        lock.lock();
        try
        {
            return entries.putIfAbsent(entry.identity(), entry) == null;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes an identity. Idempotent.
     *
     * @param identity the identity
     * @return the removed entry, or empty if none was registered
     */
    public Optional<DirectoryEntry> remove(String identity)
    {
        lock.lock();
        try
        {
            return Optional.ofNullable(entries.remove(identity));
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes an identity only if it is still bound to the given connection.
     *
     * <p>Cleanup of an old connection must not remove a newer registration that
     * reused the same identity.</p>
     *
     * @param identity the identity
     * @param handle   the connection expected to own it
     * @return true if the entry was removed
     */
    public boolean remove(String identity, PeerHandle handle)
    {
        lock.lock();
        try
        {
            DirectoryEntry entry = entries.get(identity);
            if (entry == null || entry.handle() != handle)
            {
                return false;
            }
            entries.remove(identity);
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes every entry.
     *
     * @return the removed entries in registration order
     */
    public List<DirectoryEntry> clear()
    {
        lock.lock();
        try
        {
            List<DirectoryEntry> removed = new ArrayList<>(entries.values());
            entries.clear();
            return removed;
        }
        finally
        {
            lock.unlock();
        }
    }

    // ========== Lookup ==========

    public Optional<DirectoryEntry> find(String identity)
    {
        lock.lock();
        try
        {
            return Optional.ofNullable(entries.get(identity));
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Returns all entries in registration order.
     *
     * @return an immutable copy
     */
    public List<DirectoryEntry> snapshot()
    {
        lock.lock();
        try
        {
            return List.copyOf(entries.values());
        }
        finally
        {
            lock.unlock();
        }
    }

    public List<String> identities()
    {
        lock.lock();
        try
        {
            return List.copyOf(entries.keySet());
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Returns the public keys of every peer except one.
     *
     * @param identity the identity to leave out
     * @return identity to PEM, in registration order
     */
    public Map<String, String> publicKeysExcluding(String identity)
    {
        lock.lock();
        try
        {
            Map<String, String> keys = new LinkedHashMap<>();
            for (DirectoryEntry entry : entries.values())
            {
                if (!entry.identity().equals(identity))
                {
                    keys.put(entry.identity(), entry.publicKeyPem());
                }
            }
            return keys;
        }
        finally
        {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try
        {
            return entries.size();
        }
        finally
        {
            lock.unlock();
        }
    }

    // ========== Compound Actions ==========

    public void exclusive(Runnable action)
    {
        lock.lock();
        try
        {
            action.run();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Runs an action while holding the directory lock.
     *
     * @param action the action
     * @param <T>    result type
     * @return the action's result
     */
    public <T> T exclusive(Supplier<T> action)
    {
        lock.lock();
        try
        {
            return action.get();
        }
        finally
        {
            lock.unlock();
        }
    }
}
