package io.echomail.backend.bounce;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SuppressedAddressRepository extends JpaRepository<SuppressedAddress, String> {

  List<SuppressedAddress> findByAddressIn(Collection<String> addresses);

  List<SuppressedAddress> findAllByOrderBySuppressedAtAsc();
}
