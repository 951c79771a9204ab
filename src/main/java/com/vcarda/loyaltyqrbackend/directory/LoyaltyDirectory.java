package com.vcarda.loyaltyqrbackend.directory;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the customer, business and loyalty entities that codes point at.
 *
 * The QR engine never trusts identifiers from scanned text; it resolves them here from the
 * persisted code record. Views are immutable snapshots.
 */
public interface LoyaltyDirectory {

    Optional<CustomerView> lookupCustomer(Long customerId);

    Optional<BusinessView> lookupBusiness(Long businessId);

    Optional<ProgramView> lookupProgram(Long programId);

    Optional<CardView> lookupCard(Long cardId);

    /** Active cards the customer holds at the business, oldest first. */
    List<CardView> findCards(Long customerId, Long businessId);

    /** Active programs a customer could enroll in at the business. */
    List<ProgramView> findActivePrograms(Long businessId);

    @Value
    class CustomerView {
        Long id;
        String name;
        boolean active;
    }

    @Value
    class BusinessView {
        Long id;
        String name;
        boolean active;
    }

    @Value
    class ProgramView {
        Long id;
        Long businessId;
        String name;
        boolean active;
    }

    @Value
    class CardView {
        Long id;
        Long customerId;
        Long programId;
        Long businessId;
        String cardNumber;
        long points;
        boolean active;
    }
}
