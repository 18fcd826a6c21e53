package com.ospicorp.geosimple.company;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Transactional write and read path for companies. Data access failures propagate untranslated;
 * {@link CompanyService} maps them once the transaction has ended.
 */
@Component
public class CompanyStore {
  private static final Logger log = LoggerFactory.getLogger(CompanyStore.class);

  private final CompanyRepository repository;
  private final CoordinateDerivation derivation;

  public CompanyStore(CompanyRepository repository, CoordinateDerivation derivation) {
    this.repository = repository;
    this.derivation = derivation;
  }

  @Transactional
  public Company insert(Company company) {
    requireName(company);
    Integer id = company.getId();
    if (id != null && repository.existsById(id)) {
      throw CompanyConstraintException.duplicateId(id);
    }
    if (id == null) {
      company.setId(nextFreeId());
    }
    derivation.derive(company);
    Company stored = repository.saveAndFlush(company);
    log.info("Inserted company {} ({}) with geom {}", stored.getId(), stored.getName(),
        stored.getGeom() != null ? stored.getGeom().toText() : null);
    return stored;
  }

  @Transactional(readOnly = true)
  public Company select(int id) {
    return repository.findById(id).orElseThrow(() -> new CompanyNotFoundException(id));
  }

  /**
   * Replaces name and coordinates of a stored company and derives its geometry again. The
   * database trigger only fires on insert, so this is the one path that moves {@code geom}.
   */
  @Transactional
  public Company update(int id, Company changes) {
    requireName(changes);
    Company existing = repository.findById(id)
        .orElseThrow(() -> new CompanyNotFoundException(id));
    existing.setName(changes.getName());
    existing.setLatitude(changes.getLatitude());
    existing.setLongitude(changes.getLongitude());
    derivation.derive(existing);
    Company stored = repository.saveAndFlush(existing);
    log.info("Updated company {} with geom {}", id,
        stored.getGeom() != null ? stored.getGeom().toText() : null);
    return stored;
  }

  @Transactional
  public void delete(int id) {
    if (!repository.existsById(id)) {
      throw new CompanyNotFoundException(id);
    }
    repository.deleteById(id);
    repository.flush();
    log.info("Deleted company {}", id);
  }

  // Caller-supplied ids do not advance the serial sequence, so skip values already taken.
  private int nextFreeId() {
    int candidate = Math.toIntExact(repository.nextId());
    while (repository.existsById(candidate)) {
      log.debug("Generated id {} already in use, drawing the next one", candidate);
      candidate = Math.toIntExact(repository.nextId());
    }
    return candidate;
  }

  private static void requireName(Company company) {
    if (company == null) {
      throw CompanyConstraintException.missingField("company");
    }
    if (!StringUtils.hasText(company.getName())) {
      throw CompanyConstraintException.missingField("name");
    }
  }
}
