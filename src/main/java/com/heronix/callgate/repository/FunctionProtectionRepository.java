package com.heronix.callgate.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.FunctionProtection;
import com.heronix.callgate.model.domain.Selector;

/**
 * Repository for protection flags held on behalf of proxy-hosted integrations.
 */
@Repository
public interface FunctionProtectionRepository extends JpaRepository<FunctionProtection, Long> {

    Optional<FunctionProtection> findByIdentityAndSelector(Address identity, Selector selector);

    List<FunctionProtection> findByIdentityAndSelectorIn(Address identity, Collection<Selector> selectors);

    List<FunctionProtection> findByIdentityAndEnabledTrue(Address identity);
}
