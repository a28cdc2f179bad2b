package com.tenantseed.model;

/**
 * Closed set of modules a tag can belong to, with the kind of target its assignments point at.
 */
public enum TagModule {

    CONTACT(TagTargetKind.PARTY),
    ORGANIZATION(TagTargetKind.PARTY),
    ANIMAL(TagTargetKind.ANIMAL),
    BREEDING_PLAN(TagTargetKind.BREEDING_PLAN),
    WAITLIST_ENTRY(TagTargetKind.WAITLIST_ENTRY),
    OFFSPRING_GROUP(TagTargetKind.OFFSPRING_GROUP),
    OFFSPRING(TagTargetKind.OFFSPRING);

    private final TagTargetKind targetKind;

    TagModule(TagTargetKind targetKind) {
        this.targetKind = targetKind;
    }

    public TagTargetKind targetKind() {
        return targetKind;
    }
}
