package com.fhi.my_pets.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class OwnerCreateDto {

    @NotBlank @Size(max = 100)
    private String lastName;

    @NotBlank @Size(max = 100)
    private String firstName;

    @NotBlank @Email @Size(max = 255)
    private String email;

    @NotBlank @Size(max = 50)
    private String phoneNumber;
}
