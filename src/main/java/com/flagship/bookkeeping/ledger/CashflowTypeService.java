package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.exception.NotFoundException;
import com.flagship.bookkeeping.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registry of cash-flow classifications.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashflowTypeService {

    private final CashflowTypeRepository repository;

    @Transactional(readOnly = true)
    public List<CashflowType> listCashflowTypes(boolean activeOnly) {
        List<CashflowTypeEntity> entities = activeOnly
            ? repository.findByActiveTrueOrderBySortOrderAscIdAsc()
            : repository.findAllByOrderBySortOrderAscIdAsc();
        return entities.stream().map(CashflowTypeEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public Optional<CashflowType> getCashflowType(Long id) {
        return repository.findById(id).map(CashflowTypeEntity::toDomain);
    }

    @Transactional
    public CashflowType createCashflowType(CashflowTypeRequest request) {
        if (request.getCode() == null || request.getCode().isBlank()) {
            throw new ValidationException("Cash-flow type code is required");
        }
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Cash-flow type name is required");
        }
        if (request.getFlowType() == null || request.getDirection() == null) {
            throw new ValidationException("Cash-flow type requires a flow type and a direction");
        }
        if (repository.existsByCode(request.getCode())) {
            throw new ValidationException("Cash-flow type code '" + request.getCode() + "' already exists");
        }
        CashflowTypeEntity saved = repository.save(CashflowTypeEntity.create(request));
        log.info("Created cash-flow type: id={}, code={}, flowType={}, direction={}",
                saved.getId(), saved.getCode(), saved.getFlowType(), saved.getDirection());
        return saved.toDomain();
    }

    /**
     * Deactivated types stay valid on historical splits but are hidden from pick lists.
     */
    @Transactional
    public CashflowType setActive(Long id, boolean active) {
        CashflowTypeEntity entity = repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Cash-flow type", id));
        entity.setActive(active);
        return entity.toDomain();
    }

    /**
     * Fails with one error listing every id that does not exist.
     */
    @Transactional(readOnly = true)
    public void ensureExist(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        Set<Long> wanted = new TreeSet<>(ids);
        Set<Long> found = repository.findAllById(wanted).stream()
            .map(CashflowTypeEntity::getId)
            .collect(Collectors.toSet());
        wanted.removeAll(found);
        if (!wanted.isEmpty()) {
            throw new ValidationException("Cash-flow types not found: " +
                wanted.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
    }
}
