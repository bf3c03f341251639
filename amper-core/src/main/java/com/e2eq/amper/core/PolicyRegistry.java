package com.e2eq.amper.core;

import com.e2eq.amper.exceptions.DuplicateKeyException;
import com.e2eq.amper.exceptions.InvalidTemplateStateException;
import com.e2eq.amper.iam.PolicyLimits;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide store of policy templates, accounts and containers.
 *
 * <p>All state is guarded by one reader-writer lock. Registration takes it exclusively; attaching
 * and composing on any container take it shared, always before the container's own lock.</p>
 */
public class PolicyRegistry {

    private static final Logger LOG = Logger.getLogger(PolicyRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, PolicyTemplate> policyTemplates = new HashMap<>();
    private final Map<String, Account> accounts = new HashMap<>();
    private final Map<String, Container> containers = new LinkedHashMap<>();

    private final PolicyLimits limits;

    public PolicyRegistry() {
        this(PolicyLimits.defaults());
    }

    public PolicyRegistry(PolicyLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits cannot be null");
    }

    /**
     * Create a container bound to this registry.
     *
     * @throws DuplicateKeyException when a container with this id already exists
     */
    public Container addContainer(String id) throws DuplicateKeyException {
        Objects.requireNonNull(id, "container id cannot be null");
        lock.writeLock().lock();
        try {
            if (containers.containsKey(id)) {
                throw new DuplicateKeyException("container", id);
            }
            Container container = new Container(this, id);
            containers.put(id, container);
            LOG.infof("Added container '%s'", id);
            return container;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws DuplicateKeyException when an account with the same name already exists
     */
    public void addAccount(Account account) throws DuplicateKeyException {
        Objects.requireNonNull(account, "account cannot be null");
        lock.writeLock().lock();
        try {
            if (accounts.containsKey(account.name())) {
                throw new DuplicateKeyException("account", account.name());
            }
            accounts.put(account.name(), account);
            LOG.infof("Added account '%s'", account.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    void addPolicyTemplate(PolicyTemplate template, Container container)
            throws DuplicateKeyException, InvalidTemplateStateException {
        Objects.requireNonNull(template, "policy template cannot be null");
        if (container.getRegistry() != this) {
            throw new IllegalArgumentException("container '" + container.getId() + "' belongs to another registry");
        }

        lock.writeLock().lock();
        try {
            if (policyTemplates.containsKey(template.getKey())) {
                throw new DuplicateKeyException("policy template", template.getKey());
            }
            if (!template.bind(new PolicyTemplate.Binding(this, container))) {
                throw new InvalidTemplateStateException(template.getKey());
            }
            policyTemplates.put(template.getKey(), template);
            LOG.infof("Added policy template '%s' from container '%s'", template.getKey(), container.getId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<PolicyTemplate> policyTemplate(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(policyTemplates.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Account> account(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(accounts.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Container> container(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(containers.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Container> containers() {
        lock.readLock().lock();
        try {
            return List.copyOf(containers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int policyTemplateCount() {
        lock.readLock().lock();
        try {
            return policyTemplates.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int accountCount() {
        lock.readLock().lock();
        try {
            return accounts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public PolicyLimits limits() {
        return limits;
    }

    // the lookups below expect the caller to hold at least the read lock

    PolicyTemplate lookupPolicyTemplate(String key) {
        return policyTemplates.get(key);
    }

    Account lookupAccount(String name) {
        return accounts.get(name);
    }

    Lock readLock() {
        return lock.readLock();
    }
}
