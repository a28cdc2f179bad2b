package com.tenantseed.service;

import com.tenantseed.model.PartyLink;
import com.tenantseed.model.RefKind;
import com.tenantseed.repository.AnimalRepository;
import com.tenantseed.repository.BreedingPlanRepository;
import com.tenantseed.repository.ContactRepository;
import com.tenantseed.repository.OrganizationRepository;
import com.tenantseed.repository.TitleDefinitionRepository;
import com.tenantseed.repository.UserRepository;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Persistence fallbacks for the reference resolver, one per reference kind. These cover
 * re-runs against a store that was seeded by an earlier run.
 */
@Component
public class ReferenceLookups {

    private final Map<RefKind, NaturalKeyLookup> lookups = new EnumMap<>(RefKind.class);

    public ReferenceLookups(OrganizationRepository organizations,
                            ContactRepository contacts,
                            AnimalRepository animals,
                            BreedingPlanRepository plans,
                            UserRepository users,
                            TitleDefinitionRepository titleDefinitions) {
        lookups.put(RefKind.ORGANIZATION_PARTY,
            (tenantId, scope, key) -> organizations.findByName(tenantId, key).map(PartyLink::partyId));
        lookups.put(RefKind.CONTACT_PARTY,
            (tenantId, scope, key) -> contacts.findByEmail(tenantId, key).map(PartyLink::partyId));
        lookups.put(RefKind.ANIMAL,
            (tenantId, scope, key) -> animals.findId(tenantId, key, scope));
        lookups.put(RefKind.BREEDING_PLAN,
            (tenantId, scope, key) -> plans.findIdByName(tenantId, key));
        lookups.put(RefKind.MARKETPLACE_USER,
            (tenantId, scope, key) -> users.findIdByEmail(key));
        lookups.put(RefKind.TITLE_DEFINITION,
            (tenantId, scope, key) -> titleDefinitions.findIdByAbbreviation(scope, key));
    }

    public Map<RefKind, NaturalKeyLookup> all() {
        return Map.copyOf(lookups);
    }
}
