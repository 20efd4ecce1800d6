package com.umitunal.taskq.storage;

import com.umitunal.taskq.config.StorageConfig;
import com.umitunal.taskq.core.StoreException;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RocksDB-backed KeyValueStore.
 * Opened as an OptimisticTransactionDB so checked atomic writes commit without holding locks;
 * a write conflict surfaces as a failed commit rather than an error.
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksKeyValueStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong conflictCount = new AtomicLong(0);

    public RocksKeyValueStore(StorageConfig config) throws StoreException {
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        // The WAL stays on so a reopened store sees every acknowledged write;
        // durable writes additionally fsync it.
        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();

        // Scans must not pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            closeOptions();
            throw new StoreException("Failed to open RocksDB at " + config.getDataDirectory(), e);
        }
        log.info("Opened RocksDB store at {} (durableWrites={})", config.getDataDirectory(), config.isDurableWrites());
    }

    @Override
    public Optional<byte[]> get(KeyPath key) throws StoreException {
        try {
            return Optional.ofNullable(transactionDB.get(readOpts, key.encodedView()));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read " + key, e);
        }
    }

    @Override
    public void set(KeyPath key, byte[] value) throws StoreException {
        try {
            transactionDB.put(writeOpts, key.encodedView(), value);
        } catch (RocksDBException e) {
            throw new StoreException("Failed to write " + key, e);
        }
    }

    @Override
    public void delete(KeyPath key) throws StoreException {
        try {
            transactionDB.delete(writeOpts, key.encodedView());
        } catch (RocksDBException e) {
            throw new StoreException("Failed to delete " + key, e);
        }
    }

    @Override
    public List<Entry> list(KeyPath prefix, KeyPath startAfter, int limit) throws StoreException {
        byte[] prefixBytes = prefix.encodedView();
        List<Entry> result = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            boolean resume = startAfter != null && startAfter.compareTo(prefix) > 0;
            iter.seek(resume ? startAfter.encodedView() : prefixBytes);

            while (iter.isValid() && result.size() < limit) {
                byte[] key = iter.key();
                if (!KeyPath.hasPrefix(key, prefixBytes)) {
                    break;
                }
                if (!(resume && Arrays.equals(key, startAfter.encodedView()))) {
                    result.add(new Entry(KeyPath.fromBytes(key), iter.value()));
                }
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to list " + prefix, e);
        }
        return result;
    }

    @Override
    public long count(KeyPath prefix) throws StoreException {
        byte[] prefixBytes = prefix.encodedView();
        long count = 0;

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(prefixBytes);
            while (iter.isValid() && KeyPath.hasPrefix(iter.key(), prefixBytes)) {
                count++;
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to count " + prefix, e);
        }
        return count;
    }

    @Override
    public boolean commit(AtomicWrite write) throws StoreException {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            for (AtomicWrite.Check check : write.getChecks()) {
                byte[] current = txn.getForUpdate(readOpts, check.getKey().encodedView(), true);
                if (!Arrays.equals(current, check.getExpected())) {
                    txn.rollback();
                    return false;
                }
            }
            for (AtomicWrite.Mutation mutation : write.getMutations()) {
                if (mutation.isDelete()) {
                    txn.delete(mutation.getKey().encodedView());
                } else {
                    txn.put(mutation.getKey().encodedView(), mutation.getValue());
                }
            }
            txn.commit();
            return true;
        } catch (RocksDBException e) {
            if (isConflict(e)) {
                // Another writer touched a checked key after we read it
                conflictCount.incrementAndGet();
                return false;
            }
            throw new StoreException("Failed to commit atomic write", e);
        }
    }

    /**
     * Number of atomic writes lost to concurrent writers.
     * Useful for monitoring contention.
     */
    public long getConflictCount() {
        return conflictCount.get();
    }

    /**
     * Estimated number of keys, from RocksDB's own statistics.
     */
    public long approximateSize() throws StoreException {
        try {
            return Long.parseLong(transactionDB.getProperty("rocksdb.estimate-num-keys"));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read key estimate", e);
        }
    }

    @Override
    public void close() {
        transactionDB.close();
        closeOptions();
    }

    private void closeOptions() {
        scanReadOpts.close();
        readOpts.close();
        txnOpts.close();
        writeOpts.close();
        // BlockBasedTableConfig has no close(); it goes with the Options
        dbOptions.close();
        blockCache.close();
        bloomFilter.close();
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }
}
