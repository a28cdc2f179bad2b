package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.MembershipRole;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.repository.MembershipRepository;
import com.tenantseed.repository.UserRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Login accounts: tenant owners, portal users and the global marketplace shoppers.
 */
@Component
public class UserBuilder {

    private static final Logger log = LoggerFactory.getLogger(UserBuilder.class);

    private final UserRepository users;
    private final MembershipRepository memberships;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserBuilder(UserRepository users, MembershipRepository memberships,
                       PasswordEncoder passwordEncoder, Clock clock) {
        this.users = users;
        this.memberships = memberships;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Seeds the tenant owner with an OWNER membership.
     *
     * @return the owner's user id
     */
    public long seedOwner(SeedContext ctx, TenantScope scope, UserFixture owner) {
        long userId = seedUser(ctx, owner, scope.tenantId()).id();
        ensureMembership(ctx, scope, userId, MembershipRole.OWNER, MembershipRole.STAFF);
        return userId;
    }

    /**
     * Seeds the marketplace shoppers, who belong to no tenant, and registers them for threads.
     */
    public void seedMarketplaceUsers(SeedContext ctx, List<UserFixture> shoppers) {
        List<Handle> handles = new ArrayList<>();
        for (UserFixture shopper : shoppers) {
            handles.add(Handle.named(ctx.environment().qualifyEmail(shopper.email())));
        }
        ctx.resolver().indexFixtures(0L, RefKind.MARKETPLACE_USER, handles);

        for (int i = 0; i < shoppers.size(); i++) {
            UpsertResult user = seedUser(ctx, shoppers.get(i), null);
            ctx.resolver().register(0L, RefKind.MARKETPLACE_USER, handles.get(i), user.id());
        }
    }

    /**
     * Creates the user if its qualified email is unknown. An existing user without a default
     * tenant gets {@code defaultTenantId} filled in.
     */
    public UpsertResult seedUser(SeedContext ctx, UserFixture user, Long defaultTenantId) {
        String email = ctx.environment().qualifyEmail(user.email());
        UpsertResult result = ctx.upsert().upsert(EntityKind.USER, null, email, user,
            () -> Lookup.of(users.findIdByEmail(email)),
            () -> users.save(email, user.firstName(), user.lastName(),
                passwordEncoder.encode(user.password()), user.superAdmin(), clock.instant(), defaultTenantId));

        if (!result.created() && defaultTenantId != null
                && users.backfillDefaultTenant(result.id(), defaultTenantId)) {
            log.info("    ~ Set default tenant for {}", email);
        }
        return result;
    }

    public UpsertResult ensureMembership(SeedContext ctx, TenantScope scope, long userId,
                                         MembershipRole role, MembershipRole membershipRole) {
        String key = "user " + userId + " in " + scope.qualifiedSlug();
        return ctx.upsert().upsert(EntityKind.MEMBERSHIP, scope.tenantId(), key, role,
            () -> Lookup.of(memberships.findId(userId, scope.tenantId())),
            () -> memberships.save(userId, scope.tenantId(), role, membershipRole));
    }
}
