package com.vtb.nessus.web;

import com.vtb.nessus.models.ReportBundle;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Ограниченный кэш готовых отчетов.
 * При превышении емкости вытесняются самые старые записи (по порядку вставки).
 */
@Slf4j
public class ReportCache {

    private final int capacity;
    private final Map<String, ReportBundle> bundles = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public ReportCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Емкость кэша должна быть положительной: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Сохранить отчет под новым идентификатором
     *
     * @param factory строит bundle по выданному идентификатору
     * @return сохраненный bundle
     */
    public ReportBundle store(Function<String, ReportBundle> factory) {
        String reportId = newReportId();
        ReportBundle bundle = factory.apply(reportId);
        if (bundle == null || !reportId.equals(bundle.getReportId())) {
            throw new IllegalStateException("Bundle должен использовать выданный идентификатор " + reportId);
        }
        lock.lock();
        try {
            bundles.put(reportId, bundle);
            Iterator<String> oldest = bundles.keySet().iterator();
            while (bundles.size() > capacity && oldest.hasNext()) {
                String evicted = oldest.next();
                oldest.remove();
                log.debug("Отчет {} вытеснен из кэша", evicted);
            }
        } finally {
            lock.unlock();
        }
        return bundle;
    }

    public Optional<ReportBundle> get(String reportId) {
        if (reportId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(bundles.get(reportId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return bundles.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    static String newReportId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
