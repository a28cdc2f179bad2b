package com.tenantseed.service;

import com.tenantseed.exception.NaturalKeyConflictException;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.SeedTally;
import com.tenantseed.model.UpsertResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IdempotentUpsertTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private SeedTally tally;
    private IdempotentUpsert upsert;

    @BeforeEach
    void setUp() {
        tally = new SeedTally();
        upsert = new IdempotentUpsert(new TransactionTemplate(transactionManager), tally);
    }

    @Test
    void createsInsideATransactionWhenAbsent() {
        UpsertResult result = upsert.upsert(EntityKind.TENANT, null, "dev-shire", "The Shire",
            Lookup::absent, () -> 42L);

        assertThat(result).isEqualTo(new UpsertResult(42L, true));
        assertThat(tally.created(EntityKind.TENANT)).isEqualTo(1);
        verify(transactionManager).commit(any());
    }

    @Test
    void returnsExistingWithoutCreating() {
        AtomicInteger creates = new AtomicInteger();

        UpsertResult result = upsert.upsert(EntityKind.TENANT, null, "dev-shire", "The Shire",
            () -> Lookup.found(7L), () -> creates.incrementAndGet());

        assertThat(result).isEqualTo(new UpsertResult(7L, false));
        assertThat(creates).hasValue(0);
        assertThat(tally.existing(EntityKind.TENANT)).isEqualTo(1);
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    void rollsBackAndPropagatesWhenCreatorFails() {
        assertThatThrownBy(() -> upsert.upsert(EntityKind.ANIMAL, 1L, "[DEV] Grip (DOG)", "Grip",
            Lookup::absent, () -> {
                throw new IllegalStateException("genetics insert failed");
            }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("genetics insert failed");

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        assertThat(tally.created(EntityKind.ANIMAL)).isZero();
    }

    @Test
    void sameKeyWithSameAttributesIsAllowed() {
        upsert.upsert(EntityKind.USER, null, "merry.dev@buckland.local", "Merry", Lookup::absent, () -> 1L);

        UpsertResult again = upsert.upsert(EntityKind.USER, null, "merry.dev@buckland.local", "Merry",
            () -> Lookup.found(1L), () -> 2L);

        assertThat(again.created()).isFalse();
        assertThat(again.id()).isEqualTo(1L);
    }

    @Test
    void sameKeyWithDifferentAttributesConflicts() {
        upsert.upsert(EntityKind.USER, null, "merry.dev@buckland.local", "Merry", Lookup::absent, () -> 1L);

        assertThatThrownBy(() -> upsert.upsert(EntityKind.USER, null, "merry.dev@buckland.local", "Meriadoc",
            () -> Lookup.found(1L), () -> 2L))
            .isInstanceOf(NaturalKeyConflictException.class)
            .hasMessageContaining("merry.dev@buckland.local");
    }

    @Test
    void sameKeyInAnotherTenantIsIndependent() {
        upsert.upsert(EntityKind.BREEDING_PLAN, 1L, "[DEV] Litter", "A", Lookup::absent, () -> 1L);
        upsert.upsert(EntityKind.BREEDING_PLAN, 2L, "[DEV] Litter", "B", Lookup::absent, () -> 2L);

        assertThat(tally.created(EntityKind.BREEDING_PLAN)).isEqualTo(2);
    }
}
