package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.OffspringKeeperIntent;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.SeededLitter;
import com.tenantseed.model.TagModule;
import com.tenantseed.model.TagTarget;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.OffspringFixture;
import com.tenantseed.model.fixture.OffspringGroupFixture;
import com.tenantseed.repository.TagRepository;
import com.tenantseed.service.SeedContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Seeds the same tag set in every tenant and tags the first few contacts, organizations,
 * animals and breeding plans by position. Offspring groups and offspring are tagged from their
 * placement and keeper state instead.
 */
@Component
public class TagBuilder {

    record TagDefinition(TagModule module, String name, String color) {
    }

    static final List<TagDefinition> TAGS = List.of(
        new TagDefinition(TagModule.CONTACT, "VIP", "#FFD700"),
        new TagDefinition(TagModule.CONTACT, "Repeat Buyer", "#4CAF50"),
        new TagDefinition(TagModule.CONTACT, "Breeder", "#2196F3"),
        new TagDefinition(TagModule.CONTACT, "Vet", "#9C27B0"),
        new TagDefinition(TagModule.CONTACT, "Pending Follow-up", "#FF9800"),

        new TagDefinition(TagModule.ORGANIZATION, "Partner", "#3F51B5"),
        new TagDefinition(TagModule.ORGANIZATION, "Supplier", "#607D8B"),
        new TagDefinition(TagModule.ORGANIZATION, "Show Club", "#E91E63"),
        new TagDefinition(TagModule.ORGANIZATION, "Rescue", "#00BCD4"),

        new TagDefinition(TagModule.ANIMAL, "Show Prospect", "#9C27B0"),
        new TagDefinition(TagModule.ANIMAL, "Pet Quality", "#8BC34A"),
        new TagDefinition(TagModule.ANIMAL, "Breeding Stock", "#FF5722"),
        new TagDefinition(TagModule.ANIMAL, "Retired", "#795548"),
        new TagDefinition(TagModule.ANIMAL, "Health Watch", "#F44336"),
        new TagDefinition(TagModule.ANIMAL, "Champion Bloodline", "#FFD700"),

        new TagDefinition(TagModule.BREEDING_PLAN, "High Priority", "#F44336"),
        new TagDefinition(TagModule.BREEDING_PLAN, "Waitlist Interest", "#4CAF50"),
        new TagDefinition(TagModule.BREEDING_PLAN, "First Litter", "#2196F3"),
        new TagDefinition(TagModule.BREEDING_PLAN, "Repeat Pairing", "#9C27B0"),

        new TagDefinition(TagModule.WAITLIST_ENTRY, "Deposit Paid", "#4CAF50"),
        new TagDefinition(TagModule.WAITLIST_ENTRY, "First Pick", "#FFD700"),
        new TagDefinition(TagModule.WAITLIST_ENTRY, "Flexible", "#03A9F4"),
        new TagDefinition(TagModule.WAITLIST_ENTRY, "Specific Request", "#FF9800"),

        new TagDefinition(TagModule.OFFSPRING_GROUP, "All Reserved", "#4CAF50"),
        new TagDefinition(TagModule.OFFSPRING_GROUP, "Available", "#2196F3"),
        new TagDefinition(TagModule.OFFSPRING_GROUP, "Photos Needed", "#FF9800"),

        new TagDefinition(TagModule.OFFSPRING, "Reserved", "#4CAF50"),
        new TagDefinition(TagModule.OFFSPRING, "Available", "#2196F3"),
        new TagDefinition(TagModule.OFFSPRING, "Keeper", "#9C27B0"),
        new TagDefinition(TagModule.OFFSPRING, "Co-own", "#FF5722")
    );

    // The i-th entry of each list is assigned to the i-th record of that kind.
    static final List<String> CONTACT_RULES = List.of("VIP", "Repeat Buyer", "Breeder");
    static final List<String> ORGANIZATION_RULES = List.of("Partner", "Show Club");
    static final List<String> ANIMAL_RULES = List.of("Show Prospect", "Breeding Stock", "Champion Bloodline", "Health Watch");
    static final List<String> BREEDING_PLAN_RULES = List.of("High Priority", "Waitlist Interest", "First Litter");

    private final TagRepository tags;

    public TagBuilder(TagRepository tags) {
        this.tags = tags;
    }

    /**
     * @param animalIds the tenant's animals in creation order
     * @param litters   the tenant's seeded offspring groups
     */
    public void build(SeedContext ctx, TenantScope scope, List<Long> animalIds, List<SeededLitter> litters) {
        Map<String, Long> tagIds = seedTags(ctx, scope);

        assignByPosition(ctx, scope, tagIds, TagModule.CONTACT, CONTACT_RULES,
            i -> partyAt(ctx, scope, RefKind.CONTACT_PARTY, i));
        assignByPosition(ctx, scope, tagIds, TagModule.ORGANIZATION, ORGANIZATION_RULES,
            i -> partyAt(ctx, scope, RefKind.ORGANIZATION_PARTY, i));
        assignByPosition(ctx, scope, tagIds, TagModule.ANIMAL, ANIMAL_RULES,
            i -> i < animalIds.size() ? TagTarget.animal(animalIds.get(i)) : null);
        assignByPosition(ctx, scope, tagIds, TagModule.BREEDING_PLAN, BREEDING_PLAN_RULES, i -> {
            Lookup plan = ctx.resolver().resolve(scope.tenantId(), RefKind.BREEDING_PLAN, Handle.indexed(i));
            return plan.isFound() ? TagTarget.breedingPlan(plan.getId()) : null;
        });

        for (SeededLitter litter : litters) {
            for (String tagName : groupTags(litter.fixture())) {
                assign(ctx, scope, tagIds.get(tagKey(TagModule.OFFSPRING_GROUP, tagName)), TagModule.OFFSPRING_GROUP,
                    tagName, TagTarget.offspringGroup(litter.groupId()));
            }
            List<OffspringFixture> children = litter.fixture().offspring();
            for (int i = 0; i < children.size(); i++) {
                for (String tagName : offspringTags(children.get(i))) {
                    assign(ctx, scope, tagIds.get(tagKey(TagModule.OFFSPRING, tagName)), TagModule.OFFSPRING,
                        tagName, TagTarget.offspring(litter.offspringIds().get(i)));
                }
            }
        }
    }

    static List<String> groupTags(OffspringGroupFixture group) {
        List<String> names = new ArrayList<>();
        List<OffspringFixture> children = group.offspring();
        if (!children.isEmpty() && children.stream().allMatch(child -> child.placementState().isSpokenFor())) {
            names.add("All Reserved");
        }
        if (children.stream().anyMatch(OffspringFixture::isAvailable)) {
            names.add("Available");
        }
        // Not yet weaned litters still need their listing photos.
        if (group.weanedAt() == null) {
            names.add("Photos Needed");
        }
        return names;
    }

    static List<String> offspringTags(OffspringFixture child) {
        List<String> names = new ArrayList<>();
        if (child.placementState().isSpokenFor()) {
            names.add("Reserved");
        }
        if (child.isAvailable()) {
            names.add("Available");
        }
        if (child.keeperIntent() == OffspringKeeperIntent.KEEP) {
            names.add("Keeper");
        }
        if (child.keeperIntent() == OffspringKeeperIntent.WITHHELD && child.placementState().isSpokenFor()) {
            names.add("Co-own");
        }
        return names;
    }

    private Map<String, Long> seedTags(SeedContext ctx, TenantScope scope) {
        long tenantId = scope.tenantId();
        Map<String, Long> ids = new HashMap<>();
        for (TagDefinition tag : TAGS) {
            UpsertResult result = ctx.upsert().upsert(EntityKind.TAG, tenantId,
                tag.name() + " (" + tag.module() + ")", tag,
                () -> Lookup.of(tags.findTagId(tenantId, tag.module(), tag.name())),
                () -> tags.saveTag(tenantId, tag.module(), tag.name(), tag.color()));
            ids.put(tagKey(tag.module(), tag.name()), result.id());
        }
        return ids;
    }

    private void assignByPosition(SeedContext ctx, TenantScope scope, Map<String, Long> tagIds,
                                  TagModule module, List<String> rules, IntFunction<TagTarget> targetAt) {
        for (int i = 0; i < rules.size(); i++) {
            TagTarget target = targetAt.apply(i);
            if (target == null) {
                continue;
            }
            String tagName = rules.get(i);
            assign(ctx, scope, tagIds.get(tagKey(module, tagName)), module, tagName, target);
        }
    }

    private void assign(SeedContext ctx, TenantScope scope, long tagId, TagModule module, String tagName,
                        TagTarget target) {
        if (!target.accepts(module)) {
            throw new IllegalArgumentException(module + " tag cannot be assigned to " + target.kind());
        }
        ctx.upsert().upsert(EntityKind.TAG_ASSIGNMENT, scope.tenantId(),
            tagName + " on " + target.kind() + " " + target.id(), target,
            () -> Lookup.of(tags.findAssignmentId(tagId, target)),
            () -> tags.saveAssignment(tagId, target));
    }

    private static TagTarget partyAt(SeedContext ctx, TenantScope scope, RefKind kind, int index) {
        Lookup party = ctx.resolver().resolve(scope.tenantId(), kind, Handle.indexed(index));
        return party.isFound() ? TagTarget.party(party.getId()) : null;
    }

    private static String tagKey(TagModule module, String name) {
        return module + ":" + name;
    }
}
