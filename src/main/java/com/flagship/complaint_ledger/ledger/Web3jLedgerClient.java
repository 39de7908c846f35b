package com.flagship.complaint_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ledger client for the ComplaintRegistry smart contract.
 *
 * Phase 1: Ledger model.
 *
 * Contract surface:
 * - logComplaint(uint256 complaintId, string city, string category)
 * - updateComplaintStatus(uint256 complaintId, uint8 status)
 * - getComplaint(uint256 complaintId) returns (tuple(uint256, string, string, address, uint256, uint8))
 *
 * Each mutating call signs a raw transaction with the configured wallet,
 * sends it and polls for the receipt. Nonces are taken from the node's
 * pending count at send time, which is only safe because callers go through
 * the SubmissionSerializer one submission at a time.
 *
 * Outcome classification:
 * - JSON-RPC error on send      -> LedgerRejectedException
 * - receipt with failed status  -> LedgerRejectedException
 * - I/O failure                 -> LedgerUnreachableException
 * - receipt polling exhausted   -> LedgerTimeoutException
 */
@Slf4j
public class Web3jLedgerClient implements LedgerClient {

    private final Web3j web3j;
    private final TransactionManager transactionManager;
    private final TransactionReceiptProcessor receiptProcessor;
    private final ContractGasProvider gasProvider;
    private final String contractAddress;

    public Web3jLedgerClient(Web3j web3j,
                             TransactionManager transactionManager,
                             TransactionReceiptProcessor receiptProcessor,
                             ContractGasProvider gasProvider,
                             String contractAddress) {
        this.web3j = web3j;
        this.transactionManager = transactionManager;
        this.receiptProcessor = receiptProcessor;
        this.gasProvider = gasProvider;
        this.contractAddress = contractAddress;
    }

    @Override
    public String senderIdentity() {
        return transactionManager.getFromAddress();
    }

    @Override
    public LedgerReceipt create(long complaintId, String city, String category) {
        List<Type> inputs = Arrays.asList(
            new Uint256(BigInteger.valueOf(complaintId)),
            new Utf8String(city),
            new Utf8String(category));
        return submit(new Function("logComplaint", inputs, Collections.emptyList()));
    }

    @Override
    public LedgerReceipt updateStatus(long complaintId, LedgerStatus status) {
        List<Type> inputs = Arrays.asList(
            new Uint256(BigInteger.valueOf(complaintId)),
            new Uint8(BigInteger.valueOf(status.getCode())));
        return submit(new Function("updateComplaintStatus", inputs, Collections.emptyList()));
    }

    @Override
    public Optional<LedgerRecord> read(long complaintId) {
        List<Type> inputs = Collections.singletonList(new Uint256(BigInteger.valueOf(complaintId)));
        List<TypeReference<?>> outputs = Collections.singletonList(new TypeReference<ComplaintStruct>() {});
        Function function = new Function("getComplaint", inputs, outputs);

        EthCall response;
        try {
            response = web3j.ethCall(
                Transaction.createEthCallTransaction(senderIdentity(), contractAddress, FunctionEncoder.encode(function)),
                DefaultBlockParameterName.LATEST
            ).send();
        } catch (IOException e) {
            throw new LedgerUnreachableException("Ledger read failed for complaint " + complaintId, e);
        }

        if (response.isReverted()) {
            return Optional.empty();
        }
        if (response.hasError()) {
            throw new LedgerRejectedException(response.getError().getMessage());
        }

        String raw = response.getValue();
        if (raw == null || raw.length() <= 2) {
            return Optional.empty();
        }

        List<Type> decoded = FunctionReturnDecoder.decode(raw, function.getOutputParameters());
        if (decoded.isEmpty()) {
            return Optional.empty();
        }

        ComplaintStruct struct = (ComplaintStruct) decoded.get(0);
        if (struct.complaintId.signum() == 0) {
            // Unset mapping slots decode as zero values
            return Optional.empty();
        }
        return Optional.of(struct.toLedgerRecord());
    }

    @Override
    public void verifyConnectivity() {
        try {
            EthBlockNumber blockNumber = web3j.ethBlockNumber().send();
            if (blockNumber.hasError()) {
                throw new LedgerUnreachableException(
                    "Ledger node returned an error: " + blockNumber.getError().getMessage(), null);
            }
            log.debug("Ledger reachable, latest block {}", blockNumber.getBlockNumber());
        } catch (IOException e) {
            throw new LedgerUnreachableException("Ledger node unreachable", e);
        }
    }

    private LedgerReceipt submit(Function function) {
        String data = FunctionEncoder.encode(function);

        EthSendTransaction sent;
        try {
            sent = transactionManager.sendTransaction(
                gasProvider.getGasPrice(function.getName()),
                gasProvider.getGasLimit(function.getName()),
                contractAddress,
                data,
                BigInteger.ZERO);
        } catch (IOException e) {
            throw new LedgerUnreachableException("Failed to send " + function.getName(), e);
        }

        if (sent.hasError()) {
            throw new LedgerRejectedException(sent.getError().getMessage());
        }

        String txHash = sent.getTransactionHash();
        log.info("Transaction sent: function={}, tx={}", function.getName(), txHash);

        TransactionReceipt receipt;
        try {
            receipt = receiptProcessor.waitForTransactionReceipt(txHash);
        } catch (TransactionException e) {
            throw new LedgerTimeoutException("No receipt for " + txHash + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new LedgerUnreachableException("Lost connection while waiting for " + txHash, e);
        }

        if (!receipt.isStatusOK()) {
            throw new LedgerRejectedException("execution reverted: " + txHash);
        }

        log.info("Transaction confirmed: tx={}, block={}, gasUsed={}",
                receipt.getTransactionHash(), receipt.getBlockNumber(), receipt.getGasUsed());

        return LedgerReceipt.of(receipt.getTransactionHash(), receipt.getBlockNumber().longValueExact());
    }

    /**
     * ABI mapping of the tuple returned by getComplaint.
     */
    public static class ComplaintStruct extends DynamicStruct {
        public final BigInteger complaintId;
        public final String city;
        public final String category;
        public final String recordedBy;
        public final BigInteger timestamp;
        public final BigInteger status;

        public ComplaintStruct(Uint256 complaintId, Utf8String city, Utf8String category,
                               Address recordedBy, Uint256 timestamp, Uint8 status) {
            super(complaintId, city, category, recordedBy, timestamp, status);
            this.complaintId = complaintId.getValue();
            this.city = city.getValue();
            this.category = category.getValue();
            this.recordedBy = recordedBy.getValue();
            this.timestamp = timestamp.getValue();
            this.status = status.getValue();
        }

        LedgerRecord toLedgerRecord() {
            return new LedgerRecord(
                complaintId.longValueExact(),
                city,
                category,
                recordedBy,
                Instant.ofEpochSecond(timestamp.longValueExact()),
                LedgerStatus.fromCode(status.intValueExact()));
        }
    }
}
