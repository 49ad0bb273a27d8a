package com.fhi.my_pets.service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.my_pets.dto.HeaviestGroupDto;
import com.fhi.my_pets.dto.OwnerCreateDto;
import com.fhi.my_pets.dto.OwnerDto;
import com.fhi.my_pets.dto.OwnerUpdateDto;
import com.fhi.my_pets.dto.PageDto;
import com.fhi.my_pets.dto.TopOwnerDto;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;
import com.fhi.my_pets.repo.OwnerRepository;
import com.fhi.my_pets.repo.PetRepository;
import com.fhi.my_pets.service.exception.ServiceException;
import com.fhi.my_pets.service.statistics.OwnerWithPets;
import com.fhi.my_pets.service.statistics.PetStatistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerService
{
    private final OwnerRepository ownerRepository;
    private final PetRepository   petRepository;
    private final PageRequests    pageRequests;


    /**
     * @throws ServiceException INVALID_ARGUMENT on a bad start or limit
     */
    @Transactional(readOnly = true)
    public PageDto<OwnerDto> findOwners(Integer start, Integer limit)
    {   return PageDto.from(ownerRepository.findAll(pageRequests.of(start, limit)), OwnerDto::from);
    }

    @Transactional(readOnly = true)
    public OwnerDto findOwnerById(Long id)
    {   return OwnerDto.from(getOwner(id));
    }

    @Transactional(readOnly = true)
    public OwnerDto findOwnerWithPets(Long id)
    {
        Owner owner = getOwner(id);
        return OwnerDto.from(owner, petRepository.findByOwnerIdOrderByIdAsc(id));
    }


    @Transactional
    public OwnerDto createOwner(OwnerCreateDto ownerDto)
    {
        Owner owner = new Owner();
        owner.setLastName   (ownerDto.getLastName());
        owner.setFirstName  (ownerDto.getFirstName());
        owner.setEmail      (ownerDto.getEmail());
        owner.setPhoneNumber(ownerDto.getPhoneNumber());

        Owner saved = ownerRepository.save(owner);
        log.info("Created owner {} '{}'", saved.getId(), saved.getFullName());
        return OwnerDto.from(saved);
    }


    /**
     * Applies the provided (non-null) fields only.
     */
    @Transactional
    public OwnerDto updateOwner(Long id, OwnerUpdateDto ownerDto)
    {
        Owner owner = getOwner(id);

        if (ownerDto.getLastName()    != null) owner.setLastName   (ownerDto.getLastName());
        if (ownerDto.getFirstName()   != null) owner.setFirstName  (ownerDto.getFirstName());
        if (ownerDto.getEmail()       != null) owner.setEmail      (ownerDto.getEmail());
        if (ownerDto.getPhoneNumber() != null) owner.setPhoneNumber(ownerDto.getPhoneNumber());

        Owner saved = ownerRepository.save(owner);
        log.info("Updated owner {}", id);
        return OwnerDto.from(saved);
    }


    /**
     * Deletes an owner who has no pets.
     *
     * @throws ServiceException OWNER_HAS_PETS if the owner still has pets: a pet can't be left without owner.
     *                          Use {@link #deleteOwnerWithPets(Long)} instead.
     */
    @Transactional
    public void deleteOwner(Long id)
    {
        Owner owner = getOwner(id);

        long petCount = petRepository.countByOwnerId(id);
        if (petCount > 0)
        {   throw ServiceException.ownerHasPets(id, petCount);
        }

        ownerRepository.delete(owner);
        log.info("Deleted owner {}", id);
    }


    /**
     * Deletes an owner and all of its pets.
     */
    @Transactional
    public void deleteOwnerWithPets(Long id)
    {
        Owner owner = getOwner(id);

        int deletedPets = petRepository.deleteByOwnerId(id);
        // The bulk delete cleared the persistence context, owner is detached by now
        ownerRepository.deleteById(owner.getId());
        log.info("Deleted owner {} and its {} pet(s)", id, deletedPets);
    }



    // -----------------------------------------
    // Statistics
    // -----------------------------------------

    @Transactional(readOnly = true)
    public List<TopOwnerDto> findTopOwnersByCount()
    {   return PetStatistics.topOwnersByCount(allOwnersWithPets());
    }

    /**
     * @throws ServiceException INVALID_ARGUMENT if species is blank
     */
    @Transactional(readOnly = true)
    public List<TopOwnerDto> findTopOwnersBySpecies(String species)
    {
        if (species == null || species.isBlank())
        {   throw ServiceException.invalidArgument("species", "must not be blank");
        }
        return PetStatistics.topOwnersBySpecies(allOwnersWithPets(), species.trim());
    }

    @Transactional(readOnly = true)
    public List<HeaviestGroupDto> findHeaviestGroups()
    {   return PetStatistics.heaviestOwnerGroups(allOwnersWithPets());
    }



    /**
     * Every owner with its pets, in two queries: owners, then pets grouped by owner id.
     */
    private List<OwnerWithPets> allOwnersWithPets()
    {
        Map<Long, List<Pet>> petsByOwner = petRepository.findAll(Sort.by("id"))
                                                        .stream()
                                                        .collect(Collectors.groupingBy(Pet::getOwnerId));

        return ownerRepository.findAll(Sort.by("id"))
                              .stream()
                              .map(owner -> new OwnerWithPets(owner, petsByOwner.getOrDefault(owner.getId(), List.of())))
                              .toList();
    }

    private Owner getOwner(Long id)
    {   return ownerRepository.findById(id)
                              .orElseThrow(() -> ServiceException.ownerNotFound(id));
    }
}
