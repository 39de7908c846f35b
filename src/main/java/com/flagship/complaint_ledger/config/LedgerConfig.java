package com.flagship.complaint_ledger.config;

import com.flagship.complaint_ledger.ledger.InMemoryLedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.Web3jLedgerClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.gas.StaticGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.math.BigInteger;

/**
 * Ledger client wiring.
 *
 * ledger.client selects the adapter:
 * - web3j (default): ComplaintRegistry contract over JSON-RPC
 * - in-memory: process-local ledger for local runs and tests
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Configuration
    @ConditionalOnProperty(name = "ledger.client", havingValue = "web3j", matchIfMissing = true)
    static class Web3jLedgerConfig {

        @Value("${ledger.rpc-url}")
        private String rpcUrl;

        @Value("${ledger.private-key}")
        private String privateKey;

        @Value("${ledger.contract-address}")
        private String contractAddress;

        @Value("${ledger.chain-id:11155111}")
        private long chainId;

        @Value("${ledger.gas-price-wei:20000000000}")
        private BigInteger gasPriceWei;

        @Value("${ledger.gas-limit:300000}")
        private BigInteger gasLimit;

        @Value("${ledger.receipt.poll-interval-ms:2000}")
        private long receiptPollIntervalMs;

        @Value("${ledger.receipt.attempts:60}")
        private int receiptAttempts;

        @Bean
        public Web3j web3j() {
            return Web3j.build(new HttpService(rpcUrl));
        }

        @Bean
        public TransactionManager ledgerTransactionManager(Web3j web3j) {
            Credentials credentials = Credentials.create(privateKey);
            return new RawTransactionManager(web3j, credentials, chainId);
        }

        @Bean
        public LedgerClient ledgerClient(Web3j web3j, TransactionManager ledgerTransactionManager) {
            TransactionReceiptProcessor receiptProcessor =
                new PollingTransactionReceiptProcessor(web3j, receiptPollIntervalMs, receiptAttempts);
            ContractGasProvider gasProvider = new StaticGasProvider(gasPriceWei, gasLimit);

            Web3jLedgerClient client = new Web3jLedgerClient(
                web3j, ledgerTransactionManager, receiptProcessor, gasProvider, contractAddress);

            log.info("Ledger client: contract={}, sender={}, chainId={}",
                    contractAddress, client.senderIdentity(), chainId);
            return client;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.client", havingValue = "in-memory")
    static class InMemoryLedgerConfig {

        @Bean
        public LedgerClient ledgerClient(@Value("${ledger.in-memory.identity:0x000000000000000000000000000000000000beef}") String identity) {
            log.warn("Using in-memory ledger; nothing is written to a real ledger");
            return new InMemoryLedgerClient(identity);
        }
    }
}
