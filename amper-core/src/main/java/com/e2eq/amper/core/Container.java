package com.e2eq.amper.core;

import com.e2eq.amper.exceptions.DuplicateKeyException;
import com.e2eq.amper.exceptions.InvalidTemplateStateException;
import com.e2eq.amper.exceptions.MissingVariableException;
import com.e2eq.amper.exceptions.PolicyCompressionException;
import com.e2eq.amper.exceptions.TemplateRenderException;
import com.e2eq.amper.exceptions.UnknownReferenceException;
import com.e2eq.amper.exceptions.UnsupportedPolicyVersionException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Unit of composition: an append-only list of attachments from which a policy bundle is
 * computed for every account the attachments reference.
 *
 * <p>The container's lock is independent of the registry's. Operations needing both take the
 * registry lock first through {@link OrderedLocks}.</p>
 */
public class Container {

    private static final Logger LOG = Logger.getLogger(Container.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final PolicyRegistry registry;
    private final String id;
    private final List<Attachment> attachments = new ArrayList<>();

    Container(PolicyRegistry registry, String id) {
        this.registry = registry;
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }

    /**
     * Register a template with the registry, owned by this container.
     */
    public void addPolicyTemplate(PolicyTemplate template) throws DuplicateKeyException, InvalidTemplateStateException {
        registry.addPolicyTemplate(template, this);
    }

    /**
     * Attach a registered template to a registered account.
     *
     * @param policyTemplateKey key of the template
     * @param accountName name of the account
     * @param vars variable bindings, must contain every variable the template requires
     * @return the attachment appended to this container
     */
    public Attachment addAttachment(String policyTemplateKey, String accountName, Map<String, String> vars)
            throws UnknownReferenceException, MissingVariableException {
        Objects.requireNonNull(policyTemplateKey, "policy template key cannot be null");
        Objects.requireNonNull(accountName, "account name cannot be null");
        Map<String, String> bindings = vars == null ? Map.of() : vars;

        try (OrderedLocks ignored = OrderedLocks.acquire(registry.readLock(), lock.writeLock())) {
            PolicyTemplate template = registry.lookupPolicyTemplate(policyTemplateKey);
            if (template == null) {
                throw new UnknownReferenceException(UnknownReferenceException.Kind.TEMPLATE, policyTemplateKey, id);
            }

            Account account = registry.lookupAccount(accountName);
            if (account == null) {
                throw new UnknownReferenceException(UnknownReferenceException.Kind.ACCOUNT, accountName, id);
            }

            for (String varName : template.getVars()) {
                if (!bindings.containsKey(varName)) {
                    throw new MissingVariableException(varName, policyTemplateKey, id);
                }
            }

            Attachment attachment = new Attachment(template, account, bindings, id);
            attachments.add(attachment);
            LOG.debugf("Attached '%s' to account '%s' in container '%s'", policyTemplateKey, accountName, id);
            return attachment;
        }
    }

    /**
     * Compose the policy bundle of every account referenced by this container's attachments.
     *
     * @return the compressed bundle plus the attachments whose template rendered nothing
     */
    public PolicyResult policy()
            throws TemplateRenderException, UnsupportedPolicyVersionException, PolicyCompressionException {
        try (OrderedLocks ignored = OrderedLocks.acquire(registry.readLock(), lock.readLock())) {
            return new PolicyComposer(this, registry.limits()).compose(attachments);
        }
    }

    public List<Attachment> attachments() {
        lock.readLock().lock();
        try {
            return List.copyOf(attachments);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
