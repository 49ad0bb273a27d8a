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

import com.fhi.my_pets.dto.HeaviestPetDto;
import com.fhi.my_pets.dto.PageDto;
import com.fhi.my_pets.dto.PetCreateDto;
import com.fhi.my_pets.dto.PetDto;
import com.fhi.my_pets.dto.PetUpdateDto;
import com.fhi.my_pets.dto.SpeciesCountDto;
import com.fhi.my_pets.dto.TranslatedPetDto;
import com.fhi.my_pets.service.PetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/pets")
@RequiredArgsConstructor
public class PetController
{
   private final PetService petService;


   /**
    * Example: GET /api/pets?start=10&limit=12&species=cat
    */
   @GetMapping
   public ResponseEntity<PageDto<PetDto>> getPets(@RequestParam(required = false) Integer start,
                                                  @RequestParam(required = false) Integer limit,
                                                  @RequestParam(required = false) String  species)
   {  return ResponseEntity.ok(petService.findPets(start, limit, species));
   }

   @GetMapping("/{id}")
   public ResponseEntity<PetDto> getPetById(@PathVariable Long id)
   {  return ResponseEntity.ok(petService.findPetById(id));
   }

   @GetMapping("/{id}/with-owner")
   public ResponseEntity<TranslatedPetDto> getPetWithOwner(@PathVariable Long id)
   {  return ResponseEntity.ok(petService.findPetWithOwner(id));
   }

   @PostMapping
   public ResponseEntity<PetDto> createPet(@Valid @RequestBody PetCreateDto petDto)
   {  return ResponseEntity.status(HttpStatus.CREATED).body(petService.createPet(petDto));
   }

   @PatchMapping("/{id}")
   public ResponseEntity<PetDto> updatePet(@PathVariable Long id, @Valid @RequestBody PetUpdateDto petDto)
   {  return ResponseEntity.ok(petService.updatePet(id, petDto));
   }

   @DeleteMapping("/{id}")
   public ResponseEntity<Void> deletePet(@PathVariable Long id)
   {
      petService.deletePet(id);
      return ResponseEntity.noContent().build();
   }



   // -----------------------------------------
   // Statistics
   // -----------------------------------------

   @GetMapping("/stats/oldest")
   public ResponseEntity<List<PetDto>> getOldestPets()
   {  return ResponseEntity.ok(petService.findOldestPets());
   }

   /**
    * 204 No Content when there are no pets.
    */
   @GetMapping("/stats/most-common-species")
   public ResponseEntity<List<SpeciesCountDto>> getMostCommonSpecies()
   {
      return petService.findMostCommonSpecies()
                       .map(ResponseEntity::ok)
                       .orElseGet(() -> ResponseEntity.noContent().build());
   }

   /**
    * 204 No Content when there are no pets.
    */
   @GetMapping("/stats/heaviest")
   public ResponseEntity<List<HeaviestPetDto>> getHeaviestPets()
   {
      return petService.findHeaviestPets()
                       .map(ResponseEntity::ok)
                       .orElseGet(() -> ResponseEntity.noContent().build());
   }
}
