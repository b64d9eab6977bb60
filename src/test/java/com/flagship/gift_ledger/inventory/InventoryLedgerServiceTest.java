package com.flagship.gift_ledger.inventory;

import com.flagship.gift_ledger.account.AccountService;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.exception.InsufficientBalanceException;
import com.flagship.gift_ledger.exception.InvalidItemException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the inventory ledger: overdrafts, bad quantities and
 * concurrent debits against the same row.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class InventoryLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("gift_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private InventoryLedgerService inventoryLedger;

    @Autowired
    private AccountService accountService;

    @Autowired
    private CatalogService catalogService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private UUID accountId;
    private GiftDefinition beer;
    private GiftDefinition flowers;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        accountId = accountService.createAccount("holder-" + suffix + "@example.com", "Holder " + suffix, "hash");
        beer = catalogService.createGiftDefinition("Biertje " + suffix, "🍺", null, GiftCategory.DRINKS, new BigDecimal("3.50"));
        flowers = catalogService.createGiftDefinition("Bloemen " + suffix, "💐", null, GiftCategory.LIFESTYLE, new BigDecimal("12.00"));
    }

    @Test
    @DisplayName("Credits accumulate on one row")
    void testCredit_Accumulates() {
        printTestHeader("Credit Accumulates");

        inventoryLedger.credit(accountId, beer.getId(), 2);
        inventoryLedger.credit(accountId, beer.getId(), 3);

        assertEquals(5, inventoryLedger.balanceOf(accountId, beer.getId()));
        List<InventoryBalance> balances = inventoryLedger.query(accountId);
        assertEquals(1, balances.size());
        assertEquals("🍺", balances.get(0).getEmoji());
    }

    @Test
    @DisplayName("Credit past the largest storable count is an invalid item and changes nothing")
    void testCredit_HoldingOverflow() {
        printTestHeader("Credit Overflow");
        inventoryLedger.credit(accountId, beer.getId(), Integer.MAX_VALUE - 1);
        inventoryLedger.credit(accountId, beer.getId(), 1);

        InvalidItemException e = assertThrows(InvalidItemException.class,
            () -> inventoryLedger.credit(accountId, beer.getId(), 1));

        printOutput("Error", e.getMessage());
        assertEquals(beer.getId(), e.getGiftDefinitionId());
        assertEquals(Integer.MAX_VALUE, inventoryLedger.balanceOf(accountId, beer.getId()));
    }

    @Test
    @DisplayName("Debit beyond the balance fails and leaves the row untouched")
    void testDebit_Overdraft() {
        printTestHeader("Debit Overdraft");
        inventoryLedger.credit(accountId, beer.getId(), 1);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> inventoryLedger.debit(accountId, beer.getId(), 2));

        printOutput("Error", e.getMessage());
        assertEquals(1, inventoryLedger.balanceOf(accountId, beer.getId()));
    }

    @Test
    @DisplayName("Debit of a never-held gift fails")
    void testDebit_NoRow() {
        assertThrows(InsufficientBalanceException.class,
            () -> inventoryLedger.debit(accountId, flowers.getId(), 1));
        assertEquals(0, inventoryLedger.balanceOf(accountId, flowers.getId()));
    }

    @Test
    @DisplayName("Non-positive quantities are rejected")
    void testNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class, () -> inventoryLedger.credit(accountId, beer.getId(), 0));
        assertThrows(IllegalArgumentException.class, () -> inventoryLedger.debit(accountId, beer.getId(), -1));
    }

    @Test
    @DisplayName("Fully spent gifts drop out of the inventory listing")
    void testQuery_HidesZeroRows() {
        inventoryLedger.credit(accountId, beer.getId(), 1);
        inventoryLedger.credit(accountId, flowers.getId(), 2);
        inventoryLedger.debit(accountId, beer.getId(), 1);

        List<InventoryBalance> balances = inventoryLedger.query(accountId);

        assertEquals(1, balances.size());
        assertEquals(flowers.getId(), balances.get(0).getGiftDefinitionId());
        assertEquals(2, balances.get(0).getQuantity());
    }

    @Test
    @DisplayName("Inventory is ordered by category then name")
    void testQuery_Ordering() {
        inventoryLedger.credit(accountId, flowers.getId(), 1);
        inventoryLedger.credit(accountId, beer.getId(), 1);

        List<InventoryBalance> balances = inventoryLedger.query(accountId);

        assertEquals(GiftCategory.DRINKS, balances.get(0).getCategory());
        assertEquals(GiftCategory.LIFESTYLE, balances.get(1).getCategory());
    }

    @Test
    @DisplayName("Concurrent debits never take more units than held")
    void testConcurrentDebits() throws Exception {
        printTestHeader("Concurrent Debits");
        inventoryLedger.credit(accountId, beer.getId(), 5);

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    inventoryLedger.debit(accountId, beer.getId(), 1);
                    succeeded.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());
        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(0, inventoryLedger.balanceOf(accountId, beer.getId()));
    }
}
