package com.fhi.my_pets.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.my_pets.dto.HeaviestGroupDto;
import com.fhi.my_pets.dto.OwnerCreateDto;
import com.fhi.my_pets.dto.OwnerDto;
import com.fhi.my_pets.dto.OwnerUpdateDto;
import com.fhi.my_pets.dto.PageDto;
import com.fhi.my_pets.dto.TopOwnerDto;
import com.fhi.my_pets.service.OwnerService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/owners")
@RequiredArgsConstructor
public class OwnerController
{
    private final OwnerService ownerService;

    @GetMapping
    public ResponseEntity<PageDto<OwnerDto>> getOwners(@RequestParam(required = false) Integer start,
                                                       @RequestParam(required = false) Integer limit)
    {   return ResponseEntity.ok(ownerService.findOwners(start, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OwnerDto> getOwnerById(@PathVariable Long id)
    {   return ResponseEntity.ok(ownerService.findOwnerById(id));
    }

    @GetMapping("/{id}/with-pets")
    public ResponseEntity<OwnerDto> getOwnerWithPets(@PathVariable Long id)
    {   return ResponseEntity.ok(ownerService.findOwnerWithPets(id));
    }

    @PostMapping
    public ResponseEntity<OwnerDto> createOwner(@Valid @RequestBody OwnerCreateDto ownerDto)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(ownerService.createOwner(ownerDto));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<OwnerDto> updateOwner(@PathVariable Long id, @Valid @RequestBody OwnerUpdateDto ownerDto)
    {   return ResponseEntity.ok(ownerService.updateOwner(id, ownerDto));
    }

    /**
     * Refused with 409 Conflict while the owner still has pets.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteOwner(@PathVariable Long id)
    {
        ownerService.deleteOwner(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}/with-pets")
    public ResponseEntity<Void> deleteOwnerWithPets(@PathVariable Long id)
    {
        ownerService.deleteOwnerWithPets(id);
        return ResponseEntity.noContent().build();
    }


    @GetMapping("/stats/top-by-count")
    public ResponseEntity<List<TopOwnerDto>> getTopOwnersByCount()
    {   return ResponseEntity.ok(ownerService.findTopOwnersByCount());
    }

    @GetMapping("/stats/top-by-species")
    public ResponseEntity<List<TopOwnerDto>> getTopOwnersBySpecies(@RequestParam String species)
    {   return ResponseEntity.ok(ownerService.findTopOwnersBySpecies(species));
    }

    @GetMapping("/stats/heaviest-groups")
    public ResponseEntity<List<HeaviestGroupDto>> getHeaviestGroups()
    {   return ResponseEntity.ok(ownerService.findHeaviestGroups());
    }
}
