package com.tenantseed.model.fixture;

import com.tenantseed.model.OffspringFinancialState;
import com.tenantseed.model.OffspringKeeperIntent;
import com.tenantseed.model.OffspringLifeState;
import com.tenantseed.model.OffspringPaperworkState;
import com.tenantseed.model.OffspringPlacementState;

/**
 * One puppy, kitten or foal of an offspring group. Unset states read as an alive, unassigned,
 * available offspring with no money or paperwork yet.
 */
public record OffspringFixture(
    String name,
    String sex,
    String breed,
    OffspringLifeState lifeState,
    OffspringPlacementState placementState,
    OffspringKeeperIntent keeperIntent,
    OffspringFinancialState financialState,
    OffspringPaperworkState paperworkState,
    String collarColorName,
    String collarColorHex,
    Integer priceCents,
    Integer depositCents,
    String notes
) {
    public OffspringFixture {
        lifeState = lifeState == null ? OffspringLifeState.ALIVE : lifeState;
        placementState = placementState == null ? OffspringPlacementState.UNASSIGNED : placementState;
        keeperIntent = keeperIntent == null ? OffspringKeeperIntent.AVAILABLE : keeperIntent;
        financialState = financialState == null ? OffspringFinancialState.NONE : financialState;
        paperworkState = paperworkState == null ? OffspringPaperworkState.NONE : paperworkState;
    }

    public boolean hasCollar() {
        return collarColorName != null;
    }

    /**
     * Listed for sale: nobody holds it and the breeder is not keeping it back.
     */
    public boolean isAvailable() {
        return lifeState == OffspringLifeState.ALIVE
            && placementState == OffspringPlacementState.UNASSIGNED
            && keeperIntent == OffspringKeeperIntent.AVAILABLE;
    }
}
