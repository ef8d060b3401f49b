package org.csits.odrep.dao;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的复制状态仓储实现，用于本地调试和测试。
 */
@Repository
@ConditionalOnProperty(name = "odrep.persistence.type", havingValue = "memory")
public class InMemoryCopyStatusRepository implements CopyStatusRepository {

    private final AtomicLong idGenerator = new AtomicLong(0);

    private final Map<String, CopyStatusEntity> store = new ConcurrentHashMap<>();

    @Override
    public void initializeSchema() {
        // 无需建表
    }

    @Override
    public void upsert(CopyStatusEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        store.compute(entity.getTableName(), (name, existing) -> {
            CopyStatusEntity saved = copyOf(entity);
            if (existing != null) {
                saved.setId(existing.getId());
                saved.setCreatedAt(existing.getCreatedAt());
            } else {
                saved.setId(idGenerator.incrementAndGet());
                saved.setCreatedAt(now);
            }
            if (saved.getLastCopied() == null) {
                saved.setLastCopied(now);
            }
            if (saved.getCopyStatus() == null) {
                saved.setCopyStatus(CopyStatus.PENDING);
            }
            if (saved.getRowsCopied() == null) {
                saved.setRowsCopied(0L);
            }
            saved.setUpdatedAt(now);
            return saved;
        });
    }

    @Override
    public Optional<CopyStatusEntity> findByTableName(String tableName) {
        return Optional.ofNullable(store.get(tableName)).map(InMemoryCopyStatusRepository::copyOf);
    }

    @Override
    public Optional<CopyStatusEntity> findLastSuccessful(String tableName) {
        return findByTableName(tableName).filter(CopyStatusEntity::isSuccess);
    }

    @Override
    public List<CopyStatusEntity> findAll() {
        return store.values().stream()
            .sorted(Comparator.comparing(CopyStatusEntity::getTableName))
            .map(InMemoryCopyStatusRepository::copyOf)
            .collect(Collectors.toList());
    }

    private static CopyStatusEntity copyOf(CopyStatusEntity source) {
        CopyStatusEntity copy = new CopyStatusEntity();
        copy.setId(source.getId());
        copy.setTableName(source.getTableName());
        copy.setLastCopied(source.getLastCopied());
        copy.setLastPrimaryValue(source.getLastPrimaryValue());
        copy.setPrimaryColumnName(source.getPrimaryColumnName());
        copy.setRowsCopied(source.getRowsCopied());
        copy.setCopyStatus(source.getCopyStatus());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}
