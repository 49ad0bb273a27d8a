package com.fhi.my_pets.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.my_pets.dto.HeaviestPetDto;
import com.fhi.my_pets.dto.PageDto;
import com.fhi.my_pets.dto.PetCreateDto;
import com.fhi.my_pets.dto.PetDto;
import com.fhi.my_pets.dto.PetUpdateDto;
import com.fhi.my_pets.dto.SpeciesCountDto;
import com.fhi.my_pets.dto.TranslatedPetDto;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;
import com.fhi.my_pets.repo.OffsetLimitPageable;
import com.fhi.my_pets.repo.OwnerRepository;
import com.fhi.my_pets.repo.PetRepository;
import com.fhi.my_pets.service.exception.ServiceException;
import com.fhi.my_pets.service.statistics.PetStatistics;
import com.fhi.my_pets.service.translation.PetTranslator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class PetService
{
   private final PetRepository   petRepository;
   private final OwnerRepository ownerRepository;
   private final PageRequests    pageRequests;
   private final PetTranslator   petTranslator;


   /**
    * One page of pets, optionally restricted to a species (case-insensitive exact match).
    * A null or blank species means no filter.
    *
    * @throws ServiceException INVALID_ARGUMENT on a bad start or limit
    */
   @Transactional(readOnly = true)
   public PageDto<PetDto> findPets(Integer start, Integer limit, String species)
   {
      OffsetLimitPageable pageable = pageRequests.of(start, limit);
      log.debug("findPets pageable = {}, species = {}", pageable, species);

      Page<Pet> page = (species == null || species.isBlank())
                     ? petRepository.findAll(pageable)
                     : petRepository.findBySpeciesIgnoreCase(species.trim(), pageable);

      return PageDto.from(page, PetDto::from);
   }

   @Transactional(readOnly = true)
   public PetDto findPetById(Long id)
   {  return PetDto.from(getPet(id));
   }


   /**
    * The pet, its owner, and its breed / color / species translated.
    * Not transactional: the translation calls must not hold a DB connection.
    */
   public TranslatedPetDto findPetWithOwner(Long id)
   {
      Pet   pet   = getPet(id);
      Owner owner = ownerRepository.findById(pet.getOwnerId())
                                   .orElseThrow(() -> new IllegalStateException("Pet " + id + " references unknown owner " + pet.getOwnerId()));
      return petTranslator.translate(pet, owner);
   }


   /**
    * @throws ServiceException OWNER_NOT_FOUND if the referenced owner does not exist, nothing is saved then.
    */
   @Transactional
   public PetDto createPet(PetCreateDto petDto)
   {
      requireOwner(petDto.getOwnerId());

      Pet pet = new Pet();
      pet.setName       (petDto.getName());
      pet.setDateOfBirth(petDto.getDateOfBirth());
      pet.setSpecies    (petDto.getSpecies());
      pet.setBreed      (petDto.getBreed());
      pet.setColor      (petDto.getColor());
      pet.setWeight     (petDto.getWeight());
      pet.setOwnerId    (petDto.getOwnerId());

      Pet saved = petRepository.save(pet);
      log.info("Created pet {} '{}' for owner {}", saved.getId(), saved.getName(), saved.getOwnerId());
      return PetDto.from(saved);
   }


   /**
    * Applies the provided (non-null) fields only.
    *
    * @throws ServiceException PET_NOT_FOUND, or OWNER_NOT_FOUND when moving the pet to an unknown owner;
    *                          the pet is left unchanged in both cases.
    */
   @Transactional
   public PetDto updatePet(Long id, PetUpdateDto petDto)
   {
      Pet pet = getPet(id);

      // Check the new owner before touching anything
      if (petDto.getOwnerId() != null)
      {  requireOwner(petDto.getOwnerId());
      }

      if (petDto.getName()        != null) pet.setName       (petDto.getName());
      if (petDto.getDateOfBirth() != null) pet.setDateOfBirth(petDto.getDateOfBirth());
      if (petDto.getSpecies()     != null) pet.setSpecies    (petDto.getSpecies());
      if (petDto.getBreed()       != null) pet.setBreed      (petDto.getBreed());
      if (petDto.getColor()       != null) pet.setColor      (petDto.getColor());
      if (petDto.getWeight()      != null) pet.setWeight     (petDto.getWeight());
      if (petDto.getOwnerId()     != null) pet.setOwnerId    (petDto.getOwnerId());

      Pet saved = petRepository.save(pet);
      log.info("Updated pet {}", id);
      return PetDto.from(saved);
   }


   @Transactional
   public void deletePet(Long id)
   {
      if (!petRepository.existsById(id))
      {  throw ServiceException.petNotFound(id);
      }
      petRepository.deleteById(id);
      log.info("Deleted pet {}", id);
   }



   // -----------------------------------------
   // Statistics
   // -----------------------------------------

   /**
    * All pets born on the earliest date of birth; empty if there are no pets.
    */
   @Transactional(readOnly = true)
   public List<PetDto> findOldestPets()
   {
      return PetStatistics.oldest(allPets()).stream()
                          .map(PetDto::from)
                          .toList();
   }

   /**
    * @return empty if there are no pets at all
    */
   @Transactional(readOnly = true)
   public Optional<List<SpeciesCountDto>> findMostCommonSpecies()
   {  return PetStatistics.mostCommonSpecies(allPets());
   }

   /**
    * @return empty if there are no pets at all
    */
   @Transactional(readOnly = true)
   public Optional<List<HeaviestPetDto>> findHeaviestPets()
   {
      List<Pet> pets = allPets();

      Map<Long, Owner> ownersById = ownerRepository.findAllById(pets.stream().map(Pet::getOwnerId).distinct().toList())
                                                   .stream()
                                                   .collect(Collectors.toMap(Owner::getId, Function.identity()));

      return PetStatistics.heaviestPets(pets, ownersById);
   }



   private List<Pet> allPets()
   {  return petRepository.findAll(Sort.by("id"));
   }

   private Pet getPet(Long id)
   {  return petRepository.findById(id)
                          .orElseThrow(() -> ServiceException.petNotFound(id));
   }

   private void requireOwner(Long ownerId)
   {
      if (!ownerRepository.existsById(ownerId))
      {  log.debug("Owner {} not found", ownerId);
         throw ServiceException.ownerNotFound(ownerId);
      }
   }
}
