package com.fhi.my_pets.service.statistics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fhi.my_pets.dto.HeaviestGroupDto;
import com.fhi.my_pets.dto.HeaviestPetDto;
import com.fhi.my_pets.dto.SpeciesCountDto;
import com.fhi.my_pets.dto.TopOwnerDto;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;
import com.fhi.my_pets.service.exception.ServiceException;

/**
 * Extremal and grouping statistics over pets and owners already fetched from the database.
 *
 * <p>All functions are tie-inclusive: every record reaching the extremal value is returned,
 * not an arbitrary winner. Results keep the order of the input.</p>
 *
 * <p>Where "no records at all" must be told apart from "an empty answer", the result is an
 * {@link Optional}: empty means there was nothing to compute on.</p>
 */
public final class PetStatistics
{
    private PetStatistics()
    {}


    /**
     * Pets sharing the earliest date of birth.
     *
     * @return an empty list if there are no pets
     */
    public static List<Pet> oldest(List<Pet> pets)
    {
        Optional<LocalDate> earliest = pets.stream()
                                           .map(Pet::getDateOfBirth)
                                           .min(Comparator.naturalOrder());
        if (earliest.isEmpty())
        {   return List.of();
        }
        return pets.stream()
                   .filter(pet -> pet.getDateOfBirth().isEqual(earliest.get()))
                   .toList();
    }


    /**
     * Species with the most pets, species being compared exactly as stored.
     *
     * @return empty if there are no pets
     */
    public static Optional<List<SpeciesCountDto>> mostCommonSpecies(List<Pet> pets)
    {
        if (pets.isEmpty())
        {   return Optional.empty();
        }

        Map<String, Long> countBySpecies = new LinkedHashMap<>();
        for (Pet pet : pets)
        {   countBySpecies.merge(pet.getSpecies(), 1L, Long::sum);
        }

        long topCount = countBySpecies.values().stream().mapToLong(Long::longValue).max().orElseThrow();

        return Optional.of(countBySpecies.entrySet().stream()
                                         .filter(entry -> entry.getValue() == topCount)
                                         .map(entry -> new SpeciesCountDto(entry.getKey(), entry.getValue()))
                                         .toList());
    }


    /**
     * Pets with the highest weight, each with its owner.
     *
     * @param ownersById must hold the owner of every pet
     * @return empty if there are no pets
     * @throws IllegalStateException if a pet's owner is missing from {@code ownersById}
     */
    public static Optional<List<HeaviestPetDto>> heaviestPets(List<Pet> pets, Map<Long, Owner> ownersById)
    {
        if (pets.isEmpty())
        {   return Optional.empty();
        }

        double maxWeight = pets.stream().mapToDouble(Pet::getWeight).max().orElseThrow();

        return Optional.of(pets.stream()
                               .filter(pet -> pet.getWeight() == maxWeight)
                               .map(pet -> {
                                   Owner owner = ownersById.get(pet.getOwnerId());
                                   if (owner == null)
                                   {   throw new IllegalStateException("Pet " + pet.getId() + " references unknown owner " + pet.getOwnerId());
                                   }
                                   return new HeaviestPetDto(pet.getId(), pet.getName(), pet.getSpecies(), pet.getWeight(),
                                                             owner.getId(), owner.getFullName());
                               })
                               .toList());
    }


    /**
     * Owners with the most pets. Owners without pets take part: if nobody has a pet,
     * every owner is returned with a count of 0.
     *
     * @return an empty list if there are no owners
     */
    public static List<TopOwnerDto> topOwnersByCount(List<OwnerWithPets> owners)
    {
        List<TopOwnerDto> counts = owners.stream()
                                         .map(o -> new TopOwnerDto(o.owner().getId(), o.owner().getFullName(), o.pets().size()))
                                         .toList();
        return keepMaxCount(counts);
    }


    /**
     * Owners with the most pets of the given species, compared case-insensitively.
     * Owners without any pet of that species are never returned, so an unknown species
     * gives an empty list.
     *
     * @throws ServiceException INVALID_ARGUMENT if {@code species} is null or blank
     */
    public static List<TopOwnerDto> topOwnersBySpecies(List<OwnerWithPets> owners, String species)
    {
        if (species == null || species.isBlank())
        {   throw ServiceException.invalidArgument("species", "must not be blank");
        }
        String wanted = species.toLowerCase(Locale.ROOT);

        List<TopOwnerDto> counts = owners.stream()
                                         .map(o -> new TopOwnerDto(o.owner().getId(),
                                                                   o.owner().getFullName(),
                                                                   o.pets().stream()
                                                                           .filter(pet -> pet.getSpecies().toLowerCase(Locale.ROOT).equals(wanted))
                                                                           .count()))
                                         .toList();
        return keepMaxCount(counts).stream()
                                   .filter(top -> top.getCount() > 0)
                                   .toList();
    }


    /**
     * Owners whose pets weigh the most in total. An owner without pets weighs 0.
     *
     * <p>Totals are summed as decimals so that equal groups tie whatever the order of the pets.</p>
     *
     * @return an empty list if there are no owners
     */
    public static List<HeaviestGroupDto> heaviestOwnerGroups(List<OwnerWithPets> owners)
    {
        record Total(Owner owner, BigDecimal weight) {}

        List<Total> totals = owners.stream()
                                   .map(o -> new Total(o.owner(),
                                                       o.pets().stream()
                                                               .map(pet -> BigDecimal.valueOf(pet.getWeight()))
                                                               .reduce(BigDecimal.ZERO, BigDecimal::add)))
                                   .toList();

        Optional<BigDecimal> max = totals.stream().map(Total::weight).max(Comparator.naturalOrder());
        if (max.isEmpty())
        {   return List.of();
        }

        return totals.stream()
                     .filter(total -> total.weight().compareTo(max.get()) == 0)
                     .map(total -> new HeaviestGroupDto(total.owner().getId(),
                                                        total.owner().getFullName(),
                                                        total.weight().doubleValue()))
                     .toList();
    }



    private static List<TopOwnerDto> keepMaxCount(List<TopOwnerDto> counts)
    {
        long maxCount = counts.stream().mapToLong(TopOwnerDto::getCount).max().orElse(0);
        return counts.stream()
                     .filter(top -> top.getCount() == maxCount)
                     .toList();
    }
}
