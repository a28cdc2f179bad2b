package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.MessageDirection;
import com.tenantseed.model.PartyType;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.MessageFixture;
import com.tenantseed.model.fixture.ThreadFixture;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.repository.MessageRepository;
import com.tenantseed.repository.PartyRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Direct-message threads between the tenant and one client, which is either a marketplace
 * shopper or a tenant contact.
 * <p>
 * The tenant speaks through the party of its first organization. A thread, both participants
 * and every message are written in one transaction, and the thread's last-message time is
 * the newest message time.
 */
@Component
public class MessageThreadBuilder {

    private static final Logger log = LoggerFactory.getLogger(MessageThreadBuilder.class);

    private final MessageRepository messages;
    private final PartyRepository parties;
    private final Clock clock;

    public MessageThreadBuilder(MessageRepository messages, PartyRepository parties, Clock clock) {
        this.messages = messages;
        this.parties = parties;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, List<ThreadFixture> threads,
                      List<UserFixture> marketplaceUsers) {
        if (threads.isEmpty()) {
            return;
        }
        Lookup voice = ctx.resolver().resolve(scope.tenantId(), RefKind.ORGANIZATION_PARTY, Handle.indexed(0));
        if (!voice.isFound()) {
            log.warn("  ! No organization found for message threads in {}", scope.qualifiedSlug());
            return;
        }
        Instant now = clock.instant();
        for (ThreadFixture thread : threads) {
            Lookup client = resolveClient(ctx, scope, thread, marketplaceUsers);
            if (!client.isFound()) {
                log.warn("  ! No client party for thread '{}'", thread.subject());
                continue;
            }
            if (thread.messages().isEmpty()) {
                log.warn("  ! Thread '{}' has no messages", thread.subject());
                continue;
            }
            seedThread(ctx, scope, thread, voice.getId(), client.getId(), now);
        }
    }

    private void seedThread(SeedContext ctx, TenantScope scope, ThreadFixture thread, long voicePartyId,
                            long clientPartyId, Instant now) {
        long tenantId = scope.tenantId();
        List<TimedMessage> timed = new ArrayList<>();
        for (MessageFixture message : thread.messages()) {
            long sender = message.direction() == MessageDirection.INBOUND ? clientPartyId : voicePartyId;
            timed.add(new TimedMessage(message, sender,
                CommunicationTimes.ago(now, message.daysAgo(), message.hoursAgo())));
        }
        Instant lastMessageAt = timed.stream()
            .map(TimedMessage::at)
            .max(Comparator.naturalOrder())
            .orElseThrow();

        UpsertResult result = ctx.upsert().upsert(EntityKind.MESSAGE_THREAD, tenantId,
            thread.subject() + " with party " + clientPartyId, thread,
            () -> Lookup.of(messages.findThreadId(tenantId, thread.subject(), clientPartyId)),
            () -> {
                long threadId = messages.saveThread(tenantId, thread.subject(), thread.inquiryType(),
                    thread.flagged(), thread.flagged() ? now : null, thread.archived(), lastMessageAt);
                messages.saveParticipant(threadId, clientPartyId);
                messages.saveParticipant(threadId, voicePartyId);
                for (TimedMessage message : timed) {
                    messages.saveMessage(threadId, message.senderPartyId(), message.fixture().body(), message.at());
                }
                return threadId;
            });
        if (result.created()) {
            for (int i = 0; i < timed.size(); i++) {
                ctx.tally().recordCreated(EntityKind.MESSAGE);
            }
        }
    }

    private Lookup resolveClient(SeedContext ctx, TenantScope scope, ThreadFixture thread,
                                 List<UserFixture> marketplaceUsers) {
        if (thread.marketplaceUserIndex() != null) {
            int index = thread.marketplaceUserIndex();
            Lookup user = ctx.resolver().resolve(scope.tenantId(), RefKind.MARKETPLACE_USER, Handle.indexed(index));
            if (!user.isFound()) {
                return Lookup.absent();
            }
            return Lookup.found(shopperParty(ctx, scope, marketplaceUsers.get(index)));
        }
        if (thread.contactIndex() != null) {
            return ctx.resolver().resolve(scope.tenantId(), RefKind.CONTACT_PARTY, Handle.indexed(thread.contactIndex()));
        }
        return Lookup.absent();
    }

    /**
     * Shoppers have no contact record; they get a bare party in the tenant the first time they
     * appear in one of its threads.
     */
    private long shopperParty(SeedContext ctx, TenantScope scope, UserFixture shopper) {
        long tenantId = scope.tenantId();
        String email = scope.email(shopper.email());
        UpsertResult party = ctx.upsert().upsert(EntityKind.PARTY, tenantId, email, shopper,
            () -> Lookup.of(parties.findIdByEmail(tenantId, email)),
            () -> parties.save(tenantId, PartyType.CONTACT, shopper.fullName(), email, null, null, null, null));
        return party.id();
    }

    private record TimedMessage(MessageFixture fixture, long senderPartyId, Instant at) {
    }
}
