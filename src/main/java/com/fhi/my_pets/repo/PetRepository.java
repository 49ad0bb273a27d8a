package com.fhi.my_pets.repo;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fhi.my_pets.model.Pet;

public interface PetRepository extends JpaRepository<Pet, Long> 
{
    /**
     * Pets of the given species, compared case-insensitively.
     * The returned page carries the total count of matching pets.
     */
    Page<Pet> findBySpeciesIgnoreCase(String species, Pageable pageable);

    List<Pet> findByOwnerIdOrderByIdAsc(Long ownerId);

    long countByOwnerId(Long ownerId);

    /**
     * Bulk delete: bypasses the persistence context, hence the flush before and the clear after.
     *
     * @return the number of deleted pets
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Pet p where p.ownerId = :ownerId")
    int deleteByOwnerId(@Param("ownerId") Long ownerId);
}
