package com.tenantseed.model;

/**
 * Anything a tag can be attached to. Contacts and organizations are tagged through their party.
 */
public record TagTarget(TagTargetKind kind, long id) {

    public static TagTarget party(long partyId) {
        return new TagTarget(TagTargetKind.PARTY, partyId);
    }

    public static TagTarget animal(long animalId) {
        return new TagTarget(TagTargetKind.ANIMAL, animalId);
    }

    public static TagTarget breedingPlan(long planId) {
        return new TagTarget(TagTargetKind.BREEDING_PLAN, planId);
    }

    public static TagTarget offspringGroup(long groupId) {
        return new TagTarget(TagTargetKind.OFFSPRING_GROUP, groupId);
    }

    public static TagTarget offspring(long offspringId) {
        return new TagTarget(TagTargetKind.OFFSPRING, offspringId);
    }

    /**
     * True when this target may carry a tag of the given module.
     */
    public boolean accepts(TagModule module) {
        return module.targetKind() == kind;
    }
}
