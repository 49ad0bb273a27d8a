package com.fhi.my_pets.model;

import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * A person owning zero or more pets.
 *
 * <p>The owner does not hold a collection of its pets: the relationship is owned by
 * {@link Pet#getOwnerId()} and an owner's pets are fetched by owner id.
 */
@Entity
@Setter
@Getter
public class Owner
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 100)
    private String lastName;

    @NotBlank
    @Size(max = 100)
    private String firstName;

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @NotBlank
    @Size(max = 50)
    private String phoneNumber;


    /**
     * "firstName lastName", the way owners are named in statistics.
     */
    public String getFullName()
    {   return firstName + " " + lastName;
    }
}
