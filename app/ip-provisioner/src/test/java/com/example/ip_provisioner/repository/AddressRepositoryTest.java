package com.example.ip_provisioner.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.ip_provisioner.AbstractPostgresContainerTest;
import com.example.ip_provisioner.InventoryRows;
import com.example.ip_provisioner.model.AddressRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class AddressRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private AddressRepository addressRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private PlatformTransactionManager transactionManager;

  @BeforeEach
  void cleanup() {
    InventoryRows.deleteAll(jdbcTemplate);
  }

  @Test
  void insertIfAbsentReportsWhetherARowWasCreated() {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

    final int first =
        transactionTemplate.execute(
            s -> addressRepository.insertIfAbsent(AddressRecord.unallocated("us-east-1", 42L)));
    final int second =
        transactionTemplate.execute(
            s -> addressRepository.insertIfAbsent(AddressRecord.unallocated("us-east-1", 42L)));

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    assertThat(InventoryRows.findAll(jdbcTemplate, "us-east-1"))
        .containsExactly(new AddressRecord("us-east-1", 42L, Instant.EPOCH, false));
  }

  @Test
  void streamsRowsOfOneRegionInAddressOrder() {
    final Instant allocated = Instant.parse("2024-03-01T08:00:00.123456Z");
    InventoryRows.insert(jdbcTemplate, new AddressRecord("us-east-1", 30L, allocated, true));
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("us-east-1", 10L));
    InventoryRows.insert(jdbcTemplate, AddressRecord.unallocated("eu-west-1", 20L));

    final List<AddressRecord> streamed = new ArrayList<>();
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(s -> addressRepository.streamByRegion("us-east-1", 1, streamed::add));

    assertThat(streamed)
        .containsExactly(
            AddressRecord.unallocated("us-east-1", 10L),
            new AddressRecord("us-east-1", 30L, allocated, true));
    assertThat(addressRepository.countByRegion("us-east-1")).isEqualTo(2);
    assertThat(addressRepository.countByRegion("mars-1")).isZero();
  }
}
