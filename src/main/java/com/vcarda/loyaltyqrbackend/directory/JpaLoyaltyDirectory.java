package com.vcarda.loyaltyqrbackend.directory;

import com.vcarda.loyaltyqrbackend.entity.LoyaltyCard;
import com.vcarda.loyaltyqrbackend.entity.LoyaltyProgram;
import com.vcarda.loyaltyqrbackend.repository.BusinessRepository;
import com.vcarda.loyaltyqrbackend.repository.CustomerRepository;
import com.vcarda.loyaltyqrbackend.repository.LoyaltyCardRepository;
import com.vcarda.loyaltyqrbackend.repository.LoyaltyProgramRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaLoyaltyDirectory implements LoyaltyDirectory {

    private final CustomerRepository customerRepo;
    private final BusinessRepository businessRepo;
    private final LoyaltyProgramRepository programRepo;
    private final LoyaltyCardRepository cardRepo;

    @Override
    public Optional<CustomerView> lookupCustomer(Long customerId) {
        if (customerId == null) return Optional.empty();
        return customerRepo.findById(customerId)
                .map(c -> new CustomerView(c.getId(), c.getName(), c.isActive()));
    }

    @Override
    public Optional<BusinessView> lookupBusiness(Long businessId) {
        if (businessId == null) return Optional.empty();
        return businessRepo.findById(businessId)
                .map(b -> new BusinessView(b.getId(), b.getName(), b.isActive()));
    }

    @Override
    public Optional<ProgramView> lookupProgram(Long programId) {
        if (programId == null) return Optional.empty();
        return programRepo.findById(programId).map(JpaLoyaltyDirectory::toView);
    }

    @Override
    public Optional<CardView> lookupCard(Long cardId) {
        if (cardId == null) return Optional.empty();
        return cardRepo.findById(cardId).map(JpaLoyaltyDirectory::toView);
    }

    @Override
    public List<CardView> findCards(Long customerId, Long businessId) {
        return cardRepo.findByCustomerIdAndBusinessIdAndActiveTrueOrderByIdAsc(customerId, businessId)
                .stream()
                .map(JpaLoyaltyDirectory::toView)
                .collect(Collectors.toList());
    }

    @Override
    public List<ProgramView> findActivePrograms(Long businessId) {
        return programRepo.findByBusinessIdAndActiveTrueOrderByIdAsc(businessId)
                .stream()
                .map(JpaLoyaltyDirectory::toView)
                .collect(Collectors.toList());
    }

    private static ProgramView toView(LoyaltyProgram p) {
        return new ProgramView(p.getId(), p.getBusinessId(), p.getName(), p.isActive());
    }

    private static CardView toView(LoyaltyCard c) {
        return new CardView(c.getId(), c.getCustomerId(), c.getProgramId(), c.getBusinessId(),
                c.getCardNumber(), c.getPoints(), c.isActive());
    }
}
