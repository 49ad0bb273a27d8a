package com.fhi.my_pets.service.exception;

/**
 * Exception thrown by the service layer when an operation on pets or owners fails.
 *
 * <p>Use static factory methods to build a meaningful {@code ServiceException}
 * with a specific cause enum and a descriptive message.</p>
 *
 * <p>The cause tells the failure kind: a requested or referenced record does not exist,
 * an argument is invalid, the operation conflicts with existing data, or something
 * unexpected happened ({@link Cause#INTERNAL}).</p>
 */
public class ServiceException extends RuntimeException
{
    /**
     * Enum representing the specific reason why the operation failed.
     */
   public enum Cause
   {
      PET_NOT_FOUND   ("No pet found with ID: %d"),
      OWNER_NOT_FOUND ("No owner found with ID: %d"),
      INVALID_ARGUMENT("Invalid argument '%s': %s"),
      OWNER_HAS_PETS  ("Owner %d still has %d pet(s), delete them first or delete the owner with its pets"),
      INTERNAL        ("An unexpected error occurred");

      private final String messageTemplate;

      Cause(String messageTemplate)
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args)
      {  return String.format(messageTemplate, args);
      }

      public String getCode()
      {   return this.name();
      }
   }

   private final Cause causeEnum;

   /**
    * Creates a new ServiceException with a specific cause and message.
    *
    * @param causeEnum a semantic reason from the {@code Cause} enum
    * @param message a human-readable description of the failure
    */
   public ServiceException(Cause causeEnum, String message)
   {  this(causeEnum, message, null);
   }

    /**
     * Creates a new ServiceException with a cause enum, message, and underlying exception.
     *
     * @param causeEnum a semantic reason from the {@code Cause} enum
     * @param message a human-readable description
     * @param cause the original exception that triggered this one
     */
    public ServiceException(Cause causeEnum, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
    }

    /**
     * Returns the domain-specific reason for the failure.
     */
    public Cause getCauseEnum()
    {   return causeEnum;
    }


   /**
    * Returns a human-readable string representation of this exception,
    * including both the message of this exception and, if present, the
    * message of its cause.
    *
    * <pre>
    * ServiceException: Main error message | Caused by: CauseClass: Cause message
    * </pre>
    */
   @Override
   public String toString()
   {
      String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());

      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null
            && !cause.getMessage().isBlank())
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }



    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

    public static ServiceException petNotFound(Long id)
    {   return new ServiceException(Cause.PET_NOT_FOUND, Cause.PET_NOT_FOUND.format(id));
    }

    /**
     * Thrown when an owner looked up directly, or referenced by a pet, does not exist.
     */
    public static ServiceException ownerNotFound(Long id)
    {   return new ServiceException(Cause.OWNER_NOT_FOUND, Cause.OWNER_NOT_FOUND.format(id));
    }

    /**
     * @param argument name of the offending argument, e.g. "species"
     * @param reason   what is wrong with it, e.g. "must not be blank"
     */
    public static ServiceException invalidArgument(String argument, String reason)
    {   return new ServiceException(Cause.INVALID_ARGUMENT, Cause.INVALID_ARGUMENT.format(argument, reason));
    }

    public static ServiceException ownerHasPets(Long ownerId, long petCount)
    {   return new ServiceException(Cause.OWNER_HAS_PETS, Cause.OWNER_HAS_PETS.format(ownerId, petCount));
    }

    /**
     * General-purpose wrapper for unexpected failures.
     * The message stays generic: the original cause is kept for logs only.
     *
     * @param cause the original exception to wrap
     */
    public static ServiceException internal(Throwable cause)
    {   return new ServiceException(Cause.INTERNAL, Cause.INTERNAL.format(), cause);
    }
}
