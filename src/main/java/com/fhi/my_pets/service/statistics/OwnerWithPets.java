package com.fhi.my_pets.service.statistics;

import java.util.List;

import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;

/**
 * An owner together with the pets it owns, as input to the owner statistics.
 */
public record OwnerWithPets(Owner owner, List<Pet> pets)
{
    public OwnerWithPets
    {   pets = List.copyOf(pets);
    }
}
