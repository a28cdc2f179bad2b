package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.PartyLink;
import com.tenantseed.model.PartyType;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.ContactFixture;
import com.tenantseed.repository.ContactRepository;
import com.tenantseed.repository.PartyRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Contacts, each created together with the party it owns. A contact found without a party gets
 * one backfilled.
 */
@Component
public class ContactBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContactBuilder.class);

    private final ContactRepository contacts;
    private final PartyRepository parties;

    public ContactBuilder(ContactRepository contacts, PartyRepository parties) {
        this.contacts = contacts;
        this.parties = parties;
    }

    public void build(SeedContext ctx, TenantScope scope, List<ContactFixture> fixtures) {
        for (ContactFixture contact : fixtures) {
            seed(ctx, scope, contact);
        }
    }

    /**
     * @return the contact's party id
     */
    long seed(SeedContext ctx, TenantScope scope, ContactFixture contact) {
        long tenantId = scope.tenantId();
        String email = scope.email(contact.email());

        UpsertResult result = ctx.upsert().upsert(EntityKind.CONTACT, tenantId, email, contact,
            () -> Lookup.of(contacts.findByEmail(tenantId, email).map(PartyLink::entityId)),
            () -> contacts.save(tenantId, createParty(scope, contact, email), email, contact));
        if (result.created()) {
            ctx.tally().recordCreated(EntityKind.PARTY);
        }

        PartyLink link = contacts.findById(result.id())
            .orElseThrow(() -> new IllegalStateException("Contact vanished: " + email));
        long partyId;
        if (link.partyId() != null) {
            partyId = link.partyId();
        } else {
            partyId = ctx.upsert().atomically(() -> {
                long created = createParty(scope, contact, email);
                contacts.linkParty(link.entityId(), created);
                return created;
            });
            ctx.tally().recordCreated(EntityKind.PARTY);
            log.info("    ~ Backfilled party for contact {}", email);
        }

        ctx.resolver().register(tenantId, RefKind.CONTACT_PARTY, Handle.named(email), partyId);
        return partyId;
    }

    private long createParty(TenantScope scope, ContactFixture contact, String email) {
        return parties.save(scope.tenantId(), PartyType.CONTACT, contact.displayName(), email,
            contact.phone(), contact.city(), contact.state(), contact.country());
    }
}
