package com.fhi.my_pets.service.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.my_pets.dto.HeaviestGroupDto;
import com.fhi.my_pets.dto.HeaviestPetDto;
import com.fhi.my_pets.dto.SpeciesCountDto;
import com.fhi.my_pets.dto.TopOwnerDto;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;
import com.fhi.my_pets.service.exception.ServiceException;


class PetStatisticsTest
{
    private final Owner alice = owner(1L, "Alice", "Martin");
    private final Owner bruno = owner(2L, "Bruno", "Leroy");
    private final Owner chloe = owner(3L, "Chloe", "Petit");


    @DisplayName("oldest returns every pet born on the earliest date, in input order")
    @Test
    void oldest_keepsAllTies()
    {
        // GIVEN
        Pet rex  = pet(1L, "Rex",  "Dog", "2015-03-01", 30.0, alice);
        Pet milo = pet(2L, "Milo", "Cat", "2018-01-01",  5.0, bruno);
        Pet luna = pet(3L, "Luna", "Cat", "2015-03-01",  3.2, bruno);

        // WHEN
        List<Pet> oldest = PetStatistics.oldest(List.of(rex, milo, luna));

        // THEN
        assertThat(oldest).containsExactly(rex, luna);
    }

    @Test
    void noPets_oldestIsEmpty_othersHaveNoResult()
    {
        assertThat(PetStatistics.oldest(List.of())).isEmpty();
        assertThat(PetStatistics.mostCommonSpecies(List.of())).isEmpty();
        assertThat(PetStatistics.heaviestPets(List.of(), Map.of())).isEmpty();
    }


    @DisplayName("mostCommonSpecies returns all species sharing the top count")
    @Test
    void mostCommonSpecies_tie()
    {
        List<Pet> pets = List.of(pet(1L, "Rex",   "Dog",  "2015-03-01", 30.0, alice),
                                 pet(2L, "Milo",  "Cat",  "2016-03-01",  5.0, bruno),
                                 pet(3L, "Kiwi",  "Bird", "2021-05-05",  0.3, bruno),
                                 pet(4L, "Luna",  "Cat",  "2020-01-01",  3.2, bruno),
                                 pet(5L, "Bolt",  "Dog",  "2019-01-01", 12.0, alice));

        assertThat(PetStatistics.mostCommonSpecies(pets))
            .hasValueSatisfying(top -> assertThat(top).containsExactly(new SpeciesCountDto("Dog", 2),
                                                                       new SpeciesCountDto("Cat", 2)));
    }

    @Test
    void mostCommonSpecies_comparesSpeciesAsStored()
    {
        List<Pet> pets = List.of(pet(1L, "Rex",  "Dog", "2015-03-01", 30.0, alice),
                                 pet(2L, "Bolt", "dog", "2019-01-01", 12.0, alice),
                                 pet(3L, "Ace",  "dog", "2019-02-01", 11.0, alice));

        assertThat(PetStatistics.mostCommonSpecies(pets))
            .hasValueSatisfying(top -> assertThat(top).containsExactly(new SpeciesCountDto("dog", 2)));
    }


    @DisplayName("heaviestPets returns every pet at the maximum weight, with its owner")
    @Test
    void heaviestPets_tie()
    {
        List<Pet> pets = List.of(pet(1L, "Rex",  "Dog", "2015-03-01", 30.0, alice),
                                 pet(2L, "Milo", "Cat", "2016-03-01",  5.0, bruno),
                                 pet(3L, "Bolt", "Dog", "2019-01-01", 30.0, bruno));

        List<HeaviestPetDto> heaviest = PetStatistics.heaviestPets(pets, Map.of(1L, alice, 2L, bruno)).orElseThrow();

        assertThat(heaviest).extracting(HeaviestPetDto::getName, HeaviestPetDto::getOwnerFullName)
                            .containsExactly(tuple("Rex",  "Alice Martin"),
                                             tuple("Bolt", "Bruno Leroy"));
    }

    @DisplayName("When every pet ties, every pet is returned")
    @Test
    void allPetsTie()
    {
        // GIVEN same weight and same date of birth for all
        Pet rex  = pet(1L, "Rex",  "Dog",  "2019-01-01", 4.0, alice);
        Pet milo = pet(2L, "Milo", "Cat",  "2019-01-01", 4.0, bruno);
        Pet kiwi = pet(3L, "Kiwi", "Bird", "2019-01-01", 4.0, bruno);
        List<Pet> pets = List.of(rex, milo, kiwi);

        // WHEN / THEN
        assertThat(PetStatistics.oldest(pets)).containsExactly(rex, milo, kiwi);
        assertThat(PetStatistics.heaviestPets(pets, Map.of(1L, alice, 2L, bruno)).orElseThrow())
            .extracting(HeaviestPetDto::getPetId)
            .containsExactly(1L, 2L, 3L);
        assertThat(PetStatistics.mostCommonSpecies(pets).orElseThrow())
            .extracting(SpeciesCountDto::getSpecies)
            .containsExactly("Dog", "Cat", "Bird");
    }

    @Test
    void heaviestPets_missingOwner_fails()
    {
        List<Pet> pets = List.of(pet(1L, "Rex", "Dog", "2015-03-01", 30.0, alice));

        assertThatThrownBy(() -> PetStatistics.heaviestPets(pets, Map.of()))
            .isInstanceOf(IllegalStateException.class);
    }


    @DisplayName("topOwnersByCount: all owners tied at the top, including owners with 0 pets when nobody has any")
    @Test
    void topOwnersByCount()
    {
        Pet rex  = pet(1L, "Rex",  "Dog", "2015-03-01", 30.0, alice);
        Pet milo = pet(2L, "Milo", "Cat", "2016-03-01",  5.0, bruno);

        assertThat(PetStatistics.topOwnersByCount(List.of(new OwnerWithPets(alice, List.of(rex)),
                                                          new OwnerWithPets(bruno, List.of(milo)),
                                                          new OwnerWithPets(chloe, List.of()))))
            .extracting(TopOwnerDto::getOwnerId)
            .containsExactly(1L, 2L);

        assertThat(PetStatistics.topOwnersByCount(List.of(new OwnerWithPets(alice, List.of()),
                                                          new OwnerWithPets(chloe, List.of()))))
            .extracting(TopOwnerDto::getCount)
            .containsExactly(0L, 0L);

        assertThat(PetStatistics.topOwnersByCount(List.of())).isEmpty();
    }


    @Test
    void topOwnersBySpecies_isCaseInsensitive()
    {
        List<OwnerWithPets> owners = List.of(
            new OwnerWithPets(alice, List.of(pet(1L, "Rex",  "Dog", "2015-03-01", 30.0, alice))),
            new OwnerWithPets(bruno, List.of(pet(2L, "Milo", "Cat", "2016-03-01",  5.0, bruno),
                                             pet(3L, "Luna", "cat", "2020-01-01",  3.2, bruno))));

        assertThat(PetStatistics.topOwnersBySpecies(owners, "CAT"))
            .containsExactly(new TopOwnerDto(2L, "Bruno Leroy", 2));
    }

    @Test
    void topOwnersBySpecies_unknownSpecies_isEmpty()
    {
        List<OwnerWithPets> owners = List.of(
            new OwnerWithPets(alice, List.of(pet(1L, "Rex", "Dog", "2015-03-01", 30.0, alice))));

        assertThat(PetStatistics.topOwnersBySpecies(owners, "Hamster")).isEmpty();
    }

    @Test
    void topOwnersBySpecies_blankSpecies_isInvalidArgument()
    {
        assertThatThrownBy(() -> PetStatistics.topOwnersBySpecies(List.of(), "  "))
            .isInstanceOfSatisfying(ServiceException.class,
                                    e -> assertThat(e.getCauseEnum()).isEqualTo(ServiceException.Cause.INVALID_ARGUMENT));
    }


    @DisplayName("heaviestOwnerGroups ties on exact decimal totals, whatever the summing order")
    @Test
    void heaviestOwnerGroups_decimalTie()
    {
        // GIVEN 0.1 + 0.2 and 0.2 + 0.1 as doubles aren't both 0.3
        List<OwnerWithPets> owners = List.of(
            new OwnerWithPets(alice, List.of(pet(1L, "A", "Bird", "2020-01-01", 0.1, alice),
                                             pet(2L, "B", "Bird", "2020-01-01", 0.2, alice))),
            new OwnerWithPets(bruno, List.of(pet(3L, "C", "Bird", "2020-01-01", 0.3, bruno))),
            new OwnerWithPets(chloe, List.of()));

        // WHEN
        List<HeaviestGroupDto> groups = PetStatistics.heaviestOwnerGroups(owners);

        // THEN
        assertThat(groups).extracting(HeaviestGroupDto::getOwnerId).containsExactly(1L, 2L);
        assertThat(groups).extracting(HeaviestGroupDto::getTotalWeight).containsOnly(0.3);
    }

    @DisplayName("Owners without any pet all tie at a total of 0")
    @Test
    void heaviestOwnerGroups_nobodyHasPets_allOwnersTie()
    {
        List<HeaviestGroupDto> groups = PetStatistics.heaviestOwnerGroups(List.of(new OwnerWithPets(alice, List.of()),
                                                                                  new OwnerWithPets(bruno, List.of()),
                                                                                  new OwnerWithPets(chloe, List.of())));

        assertThat(groups).extracting(HeaviestGroupDto::getOwnerId).containsExactly(1L, 2L, 3L);
        assertThat(groups).extracting(HeaviestGroupDto::getTotalWeight).containsOnly(0.0);
    }

    @Test
    void heaviestOwnerGroups_equalTotals_allOwnersTie()
    {
        List<HeaviestGroupDto> groups = PetStatistics.heaviestOwnerGroups(
            List.of(new OwnerWithPets(alice, List.of(pet(1L, "A", "Dog", "2020-01-01", 10.0, alice))),
                    new OwnerWithPets(bruno, List.of(pet(2L, "B", "Cat", "2020-01-01",  4.0, bruno),
                                                     pet(3L, "C", "Cat", "2020-01-01",  6.0, bruno)))));

        assertThat(groups).extracting(HeaviestGroupDto::getOwnerId).containsExactly(1L, 2L);
    }

    @Test
    void heaviestOwnerGroups_noOwners_isEmpty()
    {   assertThat(PetStatistics.heaviestOwnerGroups(List.of())).isEmpty();
    }



    private static Owner owner(Long id, String firstName, String lastName)
    {
        Owner owner = new Owner();
        owner.setId(id);
        owner.setFirstName(firstName);
        owner.setLastName(lastName);
        owner.setEmail(firstName.toLowerCase() + "@example.com");
        owner.setPhoneNumber("0600000000");
        return owner;
    }

    private static Pet pet(Long id, String name, String species, String dateOfBirth, double weight, Owner owner)
    {
        Pet pet = new Pet();
        pet.setId(id);
        pet.setName(name);
        pet.setSpecies(species);
        pet.setBreed("Mixed");
        pet.setColor("Brown");
        pet.setDateOfBirth(LocalDate.parse(dateOfBirth));
        pet.setWeight(weight);
        pet.setOwnerId(owner.getId());
        return pet;
    }
}
