package com.fhi.my_pets.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.my_pets.model.Owner;

public interface OwnerRepository extends JpaRepository<Owner, Long> 
{}
