package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.InvoiceCategory;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.WaitlistStatus;
import com.tenantseed.model.fixture.ContactMetaFixture;
import com.tenantseed.repository.InvoiceRepository;
import com.tenantseed.repository.WaitlistRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * A contact's commercial history: a waitlist spot on a breeding plan, a paid deposit invoice
 * and one invoice summing up lifetime purchases. At most one invoice of each category is kept
 * per contact.
 */
@Component
public class WaitlistBuilder {

    private static final Logger log = LoggerFactory.getLogger(WaitlistBuilder.class);

    static final int DEFAULT_DEPOSIT_CENTS = 50_000;
    static final int APPROVED_DAYS_AGO = 30;
    static final int DEPOSIT_PAID_DAYS_AGO = 20;

    private final WaitlistRepository waitlist;
    private final InvoiceRepository invoices;
    private final Clock clock;

    public WaitlistBuilder(WaitlistRepository waitlist, InvoiceRepository invoices, Clock clock) {
        this.waitlist = waitlist;
        this.invoices = invoices;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, List<ContactMetaFixture> metas) {
        for (ContactMetaFixture meta : metas) {
            Lookup party = ctx.resolver().resolve(scope.tenantId(), RefKind.CONTACT_PARTY,
                Handle.indexed(meta.contactIndex()));
            if (!party.isFound()) {
                log.warn("  ! Contact #{} not found for contact history", meta.contactIndex());
                continue;
            }
            long partyId = party.getId();

            if (meta.wantsWaitlistEntry()) {
                seedWaitlistEntry(ctx, scope, meta, partyId);
            }
            if (hasDeposit(meta)) {
                seedDepositInvoice(ctx, scope, meta, partyId);
            }
            if (meta.totalPurchasesCents() > 0 && meta.animalsOwned() > 0) {
                seedPurchaseInvoice(ctx, scope, meta, partyId);
            }
        }
    }

    static boolean hasDeposit(ContactMetaFixture meta) {
        return meta.depositAmountCents() != null
            && (meta.hasActiveDeposit() || meta.effectiveWaitlistStatus().isDepositPaid());
    }

    private void seedWaitlistEntry(SeedContext ctx, TenantScope scope, ContactMetaFixture meta, long partyId) {
        Lookup plan = ctx.resolver().resolve(scope.tenantId(), RefKind.BREEDING_PLAN,
            Handle.indexed(meta.waitlistPlanIndex()));
        if (!plan.isFound()) {
            log.warn("  ! Breeding plan #{} not found for waitlist of contact #{}",
                meta.waitlistPlanIndex(), meta.contactIndex());
            return;
        }
        long planId = plan.getId();
        long tenantId = scope.tenantId();
        WaitlistStatus status = meta.effectiveWaitlistStatus();
        boolean paid = status.isDepositPaid();
        int required = meta.depositAmountCents() != null ? meta.depositAmountCents() : DEFAULT_DEPOSIT_CENTS;
        Instant now = clock.instant();

        ctx.upsert().upsert(EntityKind.WAITLIST_ENTRY, tenantId, "party " + partyId + " on plan " + planId, meta,
            () -> Lookup.of(waitlist.findId(tenantId, partyId, planId)),
            () -> waitlist.save(tenantId, partyId, planId, meta.waitlistPosition(), status, required,
                paid ? required : 0,
                paid ? daysBefore(now, DEPOSIT_PAID_DAYS_AGO) : null,
                status.isApproved() ? daysBefore(now, APPROVED_DAYS_AGO) : null,
                "Seeded waitlist entry - position " + meta.waitlistPosition()));
    }

    private void seedDepositInvoice(SeedContext ctx, TenantScope scope, ContactMetaFixture meta, long partyId) {
        long tenantId = scope.tenantId();
        int number = meta.contactIndex() + 1;
        int amount = meta.depositAmountCents();
        Instant now = clock.instant();

        ctx.upsert().upsert(EntityKind.INVOICE, tenantId, "deposit for party " + partyId, meta,
            () -> Lookup.of(invoices.findPaidId(tenantId, partyId, InvoiceCategory.DEPOSIT)),
            () -> invoices.savePaid(tenantId, partyId, InvoiceCategory.DEPOSIT,
                invoiceNumber(scope, "DEP", number),
                "DEP-" + referencePrefix(scope) + "-" + number,
                "waitlist", amount, amount,
                daysBefore(now, 30), daysBefore(now, 23), daysBefore(now, 25),
                "Deposit for upcoming litter"));
    }

    private void seedPurchaseInvoice(SeedContext ctx, TenantScope scope, ContactMetaFixture meta, long partyId) {
        long tenantId = scope.tenantId();
        int number = meta.contactIndex() + 1;
        Instant now = clock.instant();

        ctx.upsert().upsert(EntityKind.INVOICE, tenantId, "purchases for party " + partyId, meta,
            () -> Lookup.of(invoices.findPaidId(tenantId, partyId, InvoiceCategory.GOODS)),
            () -> invoices.savePaid(tenantId, partyId, InvoiceCategory.GOODS,
                invoiceNumber(scope, "PUR", number),
                "PUR-" + referencePrefix(scope) + "-" + number,
                "contact", meta.totalPurchasesCents(), null,
                daysBefore(now, 180), daysBefore(now, 173), daysBefore(now, 175),
                "Purchase of " + meta.animalsOwned() + " animal(s)"));
    }

    /**
     * "INV-2026-SHI-DEP0002": year, first three letters of the tenant slug, kind and contact number.
     */
    String invoiceNumber(TenantScope scope, String kind, int number) {
        String slug = scope.baseSlug();
        String tenantShort = slug.substring(0, Math.min(3, slug.length())).toUpperCase(Locale.ROOT);
        return String.format("INV-%d-%s-%s%04d", LocalDate.now(clock).getYear(), tenantShort, kind, number);
    }

    private static String referencePrefix(TenantScope scope) {
        return scope.qualifiedSlug().toUpperCase(Locale.ROOT);
    }

    private static Instant daysBefore(Instant now, int days) {
        return now.minus(Duration.ofDays(days));
    }
}
