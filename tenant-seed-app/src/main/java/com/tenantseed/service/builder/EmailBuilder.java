package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.MessageDirection;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.fixture.EmailFixture;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.repository.EmailRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Emails exchanged with contacts, each written together with its activity-feed entry.
 */
@Component
public class EmailBuilder {

    private static final Logger log = LoggerFactory.getLogger(EmailBuilder.class);

    static final int ACTIVITY_DETAIL_LENGTH = 200;

    private final EmailRepository emails;
    private final Clock clock;

    public EmailBuilder(EmailRepository emails, Clock clock) {
        this.emails = emails;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, TenantFixture fixture, long ownerUserId) {
        long tenantId = scope.tenantId();
        String tenantInbox = scope.email(fixture.owner().email());
        Instant now = clock.instant();

        for (EmailFixture email : fixture.emails()) {
            Lookup party = ctx.resolver().resolve(tenantId, RefKind.CONTACT_PARTY, Handle.indexed(email.contactIndex()));
            if (!party.isFound()) {
                log.warn("  ! Contact #{} not found for email '{}'", email.contactIndex(), email.subject());
                continue;
            }
            long partyId = party.getId();
            boolean outbound = email.direction() == MessageDirection.OUTBOUND;
            String contactEmail = scope.email(fixture.contacts().get(email.contactIndex()).email());
            Instant sentAt = CommunicationTimes.ago(now, email.daysAgo(), 0);
            String status = email.status() == null || "unread".equals(email.status()) ? "sent" : email.status();

            ctx.upsert().upsert(EntityKind.EMAIL, tenantId, email.subject() + " / " + contactEmail, email,
                () -> Lookup.of(emails.findId(tenantId, partyId, email.subject())),
                () -> {
                    long id = emails.saveEmail(tenantId, partyId, email.subject(), email.body(),
                        outbound ? contactEmail : tenantInbox, sentAt, status, email.read(),
                        outbound ? ownerUserId : null);
                    emails.saveActivity(tenantId, partyId,
                        outbound ? "EMAIL_SENT" : "EMAIL_RECEIVED",
                        (outbound ? "Sent: " : "Received: ") + email.subject(),
                        truncate(email.body()), sentAt);
                    return id;
                });
        }
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= ACTIVITY_DETAIL_LENGTH) {
            return body;
        }
        return body.substring(0, ACTIVITY_DETAIL_LENGTH);
    }
}
