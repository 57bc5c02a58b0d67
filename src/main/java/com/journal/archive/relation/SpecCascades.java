package com.journal.archive.relation;

import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.LocationSpec;
import com.journal.archive.descriptor.NameSpec;
import com.journal.archive.descriptor.NarratedDateSpec;
import com.journal.archive.descriptor.SceneSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Specs implied by other kinds: the city of every declared location is a city
 * of the entry, and every scene date is a narrated date of the entry.
 */
public final class SpecCascades {

    private SpecCascades() {
    }

    public static List<NameSpec> cities(EntryDescriptor descriptor) {
        List<NameSpec> cities = new ArrayList<>(descriptor.cities());
        for (LocationSpec location : descriptor.locations()) {
            if (location != null && location.city() != null && !location.city().isBlank()) {
                cities.add(NameSpec.of(location.city()));
            }
        }
        return cities;
    }

    public static List<NarratedDateSpec> narratedDates(EntryDescriptor descriptor) {
        List<NarratedDateSpec> dates = new ArrayList<>(descriptor.narratedDates());
        for (SceneSpec scene : descriptor.scenes()) {
            if (scene != null) {
                scene.dates().forEach(date -> dates.add(NarratedDateSpec.of(date)));
            }
        }
        return dates;
    }
}
