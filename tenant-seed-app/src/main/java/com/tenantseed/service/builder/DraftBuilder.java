package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.fixture.DraftFixture;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.repository.DraftRepository;
import com.tenantseed.service.SeedContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Unsent email and DM drafts, optionally addressed to a contact.
 */
@Component
public class DraftBuilder {

    static final int KEY_BODY_LENGTH = 40;

    private final DraftRepository drafts;
    private final Clock clock;

    public DraftBuilder(DraftRepository drafts, Clock clock) {
        this.drafts = drafts;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, TenantFixture fixture, long ownerUserId) {
        long tenantId = scope.tenantId();
        Instant now = clock.instant();

        for (DraftFixture draft : fixture.drafts()) {
            Long partyId = null;
            String toAddresses = "";
            if (draft.contactIndex() != null) {
                Lookup party = ctx.resolver().resolve(tenantId, RefKind.CONTACT_PARTY,
                    Handle.indexed(draft.contactIndex()));
                if (party.isFound()) {
                    partyId = party.getId();
                    toAddresses = scope.email(fixture.contacts().get(draft.contactIndex()).email());
                }
            }
            String channel = draft.channel().name().toLowerCase(Locale.ROOT);
            Long addressedParty = partyId;
            String addressedTo = toAddresses;

            ctx.upsert().upsert(EntityKind.DRAFT, tenantId, naturalKey(draft), draft,
                () -> Lookup.of(drafts.findId(tenantId, draft.subject(), draft.body())),
                () -> drafts.save(tenantId, addressedParty, channel, draft.subject(), addressedTo,
                    draft.body(), ownerUserId, CommunicationTimes.ago(now, draft.daysAgo(), 0)));
        }
    }

    /**
     * Drafts are keyed by subject and body; long bodies are shortened to a prefix plus hash.
     */
    static String naturalKey(DraftFixture draft) {
        String subject = draft.subject() != null ? draft.subject() : "(no subject)";
        return subject + " / " + abbreviate(draft.body());
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= KEY_BODY_LENGTH ? body : body.substring(0, KEY_BODY_LENGTH) + "... #" + body.hashCode();
    }
}
