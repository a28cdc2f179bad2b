package com.tenantseed.service;

import com.tenantseed.exception.LineageOrderException;
import com.tenantseed.model.fixture.AnimalFixture;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders a tenant's animals so that parents are created before their offspring.
 * <p>
 * This is a stable sort on the fixture's {@code generation} field, not a topological sort. It
 * is only correct because catalogue data gives every parent a strictly lower generation than
 * its children; {@link #order} checks that for parents declared in the same list and fails
 * otherwise. Parents that are not in the list are left to the animal builder, which fails the
 * tenant if they cannot be resolved.
 */
@Component
public class LineageSequencer {

    public List<AnimalFixture> order(List<AnimalFixture> animals) {
        Map<String, Integer> generations = new HashMap<>();
        for (AnimalFixture animal : animals) {
            generations.put(keyOf(animal.species(), animal.name()), animal.generation());
        }
        for (AnimalFixture animal : animals) {
            checkParent(animal, "sire", animal.sireRef(), generations);
            checkParent(animal, "dam", animal.damRef(), generations);
        }
        return animals.stream()
            .sorted(Comparator.comparingInt(AnimalFixture::generation))
            .toList();
    }

    private void checkParent(AnimalFixture child, String role, String parentRef, Map<String, Integer> generations) {
        if (parentRef == null) {
            return;
        }
        Integer parentGeneration = generations.get(keyOf(child.species(), parentRef));
        if (parentGeneration != null && parentGeneration >= child.generation()) {
            throw new LineageOrderException(String.format(
                "%s '%s' (generation %d) is not older than offspring '%s' (generation %d)",
                role, parentRef, parentGeneration, child.name(), child.generation()));
        }
    }

    private static String keyOf(String species, String name) {
        return species + "/" + name;
    }
}
