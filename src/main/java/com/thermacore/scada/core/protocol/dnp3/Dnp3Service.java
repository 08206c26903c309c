package com.thermacore.scada.core.protocol.dnp3;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.thermacore.scada.common.domain.enums.ConnectionStatus;
import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import com.thermacore.scada.common.domain.enums.Dnp3Quality;
import com.thermacore.scada.common.exception.ConnectionException;
import com.thermacore.scada.common.exception.DeviceOperationException;
import com.thermacore.scada.common.exception.ReadException;
import com.thermacore.scada.common.exception.WriteException;
import com.thermacore.scada.core.cache.DeviceDataCache;
import com.thermacore.scada.core.config.Dnp3Properties;
import com.thermacore.scada.core.connection.ConnectionHandle;
import com.thermacore.scada.core.connection.pool.ConnectionPool;
import com.thermacore.scada.core.connection.pool.DeviceConnector;
import com.thermacore.scada.core.connection.pool.PooledConnection;
import com.thermacore.scada.monitor.metrics.Dnp3PerformanceSnapshot;
import com.thermacore.scada.monitor.metrics.Dnp3PerformanceSummary;
import com.thermacore.scada.monitor.metrics.OperationStats;
import com.thermacore.scada.monitor.metrics.PerformanceMetricsRecorder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * DNP3 协议服务
 * <p>
 * 组合连接池、设备数据缓存和性能指标记录器。读取先查缓存，未命中时通过连接池获取会话，
 * 在IO线程池中执行协议读取并等待超时。断开设备会同时释放连接并清除该设备的缓存。
 */
@Slf4j
public class Dnp3Service {

    static final String OP_CONNECT = "connect";
    static final String OP_DISCONNECT = "disconnect";
    static final String OP_READ = "read";
    static final String OP_READ_DEVICE_DATA = "read_device_data";
    static final String OP_WRITE = "write_data_point";
    static final String OP_INTEGRITY_POLL = "integrity_poll";

    private final Dnp3Properties properties;
    private final Dnp3Master master;
    private final Clock clock;

    @Getter
    private final ConnectionPool connectionPool;
    @Getter
    private final DeviceDataCache<Dnp3Reading> dataCache;
    @Getter
    private final PerformanceMetricsRecorder metricsRecorder;

    private final Map<String, Dnp3DeviceContext> devices = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile boolean cachingEnabled;
    private volatile boolean bulkOperationsEnabled;
    private volatile ThreadPoolExecutor ioExecutor;
    private volatile ListeningExecutorService listeningExecutor;

    public Dnp3Service(Dnp3Properties properties, Dnp3Master master, Clock clock) {
        properties.validate();
        this.properties = properties;
        this.master = Objects.requireNonNull(master, "master");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.connectionPool = new ConnectionPool(properties.getMaxConnections(), properties.connectionTtl(),
                properties.isPoolEvictionEnabled(), clock);
        this.dataCache = new DeviceDataCache<>(properties.getCacheMaxSize(), properties.cacheTtl(),
                properties.isCacheEvictionEnabled(), clock);
        this.metricsRecorder = new PerformanceMetricsRecorder(properties.getMetricsMaxHistory(), clock);
        this.cachingEnabled = properties.isCachingEnabled();
        this.bulkOperationsEnabled = properties.isBulkOperationsEnabled();
    }

    // ==================== 生命周期 ====================

    public void init() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int threads = properties.getIoThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder()
                        .setNameFormat("dnp3-io-%d")
                        .setDaemon(true)
                        .build()
        );
        executor.allowCoreThreadTimeOut(true);
        this.ioExecutor = executor;
        this.listeningExecutor = MoreExecutors.listeningDecorator(executor);
        log.info("DNP3服务已启动, 最大连接数: {}, 连接TTL: {}s, 缓存容量: {}, 缓存TTL: {}s",
                properties.getMaxConnections(), properties.getConnectionTtlSeconds(),
                properties.getCacheMaxSize(), properties.getCacheTtlSeconds());
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        for (Dnp3DeviceContext context : devices.values()) {
            context.nextEpoch();
            context.setStatus(ConnectionStatus.DISCONNECTED);
        }
        connectionPool.closeAll();
        dataCache.clear();
        ioExecutor.shutdownNow();
        log.info("DNP3服务已停止");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== 设备管理 ====================

    /**
     * 注册设备，已存在的同名设备会先断开再替换
     */
    public void addDevice(Dnp3Device device) {
        Objects.requireNonNull(device, "device");
        if (device.getDeviceId() == null || device.getDeviceId().isBlank()) {
            throw new IllegalArgumentException("设备ID不能为空");
        }
        if (devices.containsKey(device.getDeviceId())) {
            disconnect(device.getDeviceId());
        }
        devices.put(device.getDeviceId(), new Dnp3DeviceContext(device));
        log.info("DNP3设备已添加: {} (outstation={}, {}:{})", device.getDeviceId(),
                device.getOutstationAddress(), device.getHost(), device.getPort());
    }

    /**
     * 移除设备，同时释放连接并清除缓存
     */
    public boolean removeDevice(String deviceId) {
        if (deviceId == null || !devices.containsKey(deviceId)) {
            return false;
        }
        disconnect(deviceId);
        devices.remove(deviceId);
        log.info("DNP3设备已移除: {}", deviceId);
        return true;
    }

    /**
     * 设置设备点位配置，替换原有配置并清除该设备缓存
     */
    public void addDataPointConfig(String deviceId, List<Dnp3DataPoint> dataPoints) {
        Dnp3DeviceContext context = requireDevice(deviceId, "add_data_point_config");
        Objects.requireNonNull(dataPoints, "dataPoints");
        Set<Integer> indices = new HashSet<>();
        for (Dnp3DataPoint point : dataPoints) {
            if (point == null || point.getDataType() == null) {
                throw new IllegalArgumentException("点位配置缺少数据类型: " + point);
            }
            if (!indices.add(point.getIndex())) {
                throw new IllegalArgumentException("点位索引重复: " + point.getIndex());
            }
        }
        context.setDataPoints(List.copyOf(dataPoints));
        dataCache.invalidateDevice(deviceId);
        log.info("设备点位配置已更新: {}, 点位数: {}", deviceId, dataPoints.size());
    }

    // ==================== 连接 ====================

    public void connect(String deviceId) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            Dnp3DeviceContext context = requireDevice(deviceId, OP_CONNECT);
            connectionPool.getOrCreate(deviceId, connectorFor(context));
            context.setStatus(ConnectionStatus.CONNECTED);
            success = true;
            log.info("DNP3设备已连接: {}", deviceId);
        } finally {
            recordMetric(OP_CONNECT, start, success, 0);
        }
    }

    /**
     * 断开设备：释放池中连接并清除该设备全部缓存
     */
    public void disconnect(String deviceId) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            Dnp3DeviceContext context = deviceId == null ? null : devices.get(deviceId);
            if (context != null) {
                context.nextEpoch();
                context.setStatus(ConnectionStatus.DISCONNECTED);
            }
            boolean released = connectionPool.release(deviceId);
            int dropped = dataCache.invalidateDevice(deviceId);
            success = true;
            log.info("DNP3设备已断开: {}, 释放连接: {}, 清除缓存: {} 条", deviceId, released, dropped);
        } finally {
            recordMetric(OP_DISCONNECT, start, success, 0);
        }
    }

    // ==================== 读写 ====================

    public Dnp3Reading read(String deviceId, int pointIndex) {
        return read(deviceId, pointIndex, null);
    }

    /**
     * 读取单个点位，缓存命中时不访问连接池
     *
     * @param timeout 协议读取超时，为空时使用默认配置
     */
    public Dnp3Reading read(String deviceId, int pointIndex, Duration timeout) {
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("读取超时必须大于0: " + timeout);
        }

        long start = System.nanoTime();
        boolean success = false;
        boolean fromDevice = false;
        try {
            Dnp3DeviceContext context = requireConnected(deviceId, OP_READ);
            Duration effectiveTimeout = timeout != null ? timeout : appTimeout(context);
            if (cachingEnabled) {
                Optional<Dnp3Reading> cached = dataCache.get(deviceId, pointIndex);
                if (cached.isPresent()) {
                    log.debug("缓存命中: {}:{}", deviceId, pointIndex);
                    success = true;
                    return cached.get();
                }
                log.debug("缓存未命中: {}:{}", deviceId, pointIndex);
            }

            long epoch = context.currentEpoch();
            Dnp3Session session = acquireSession(context, OP_READ, epoch);
            Dnp3DataType dataType = context.findPoint(pointIndex)
                    .map(Dnp3DataPoint::getDataType)
                    .orElse(Dnp3DataType.ANALOG_INPUT);
            Dnp3Reading raw = callDevice(() -> master.readPoint(session, dataType, pointIndex),
                    effectiveTimeout, readFailure(deviceId, OP_READ, pointIndex, effectiveTimeout));
            if (raw == null) {
                throw new ReadException("外站未返回读数", deviceId, OP_READ, pointIndex, Dnp3Quality.BAD, null);
            }

            Dnp3Reading reading = decorate(context, raw);
            if (cachingEnabled) {
                cacheIfCurrent(context, epoch, reading);
            }
            context.setLastReadAt(clock.instant());
            fromDevice = true;
            success = true;
            return reading;
        } finally {
            // 缓存命中不计入吞吐量
            recordMetric(OP_READ, start, success, fromDevice ? 1 : 0);
        }
    }

    /**
     * 读取设备全部已配置点位
     * <p>
     * 启用批量读取时按数据类型分组，每组读取一个连续区间；模拟量输入做工程值换算。
     */
    public DeviceReadResult readDeviceData(String deviceId) {
        long start = System.nanoTime();
        boolean success = false;
        int pointCount = 0;
        try {
            Dnp3DeviceContext context = requireConnected(deviceId, OP_READ_DEVICE_DATA);
            List<Dnp3DataPoint> configured = context.getDataPoints();
            if (configured.isEmpty()) {
                throw new ReadException("设备未配置点位", deviceId, OP_READ_DEVICE_DATA, null, Dnp3Quality.BAD, null);
            }

            long epoch = context.currentEpoch();
            Map<Integer, Dnp3Reading> byIndex = new HashMap<>();
            List<Dnp3DataPoint> pending = new ArrayList<>();
            int cachedPoints = 0;
            for (Dnp3DataPoint point : configured) {
                Optional<Dnp3Reading> cached = cachingEnabled
                        ? dataCache.get(deviceId, point.getIndex()) : Optional.empty();
                if (cached.isPresent()) {
                    byIndex.put(point.getIndex(), cached.get());
                    cachedPoints++;
                } else {
                    pending.add(point);
                }
            }

            if (!pending.isEmpty()) {
                Dnp3Session session = acquireSession(context, OP_READ_DEVICE_DATA, epoch);
                Duration timeout = appTimeout(context);
                Map<Integer, Dnp3Reading> fresh = bulkOperationsEnabled
                        ? readGrouped(session, deviceId, pending, timeout)
                        : readEach(session, deviceId, pending, timeout);
                for (Dnp3DataPoint point : pending) {
                    Dnp3Reading raw = fresh.get(point.getIndex());
                    if (raw == null) {
                        throw new ReadException("外站未返回点位数据", deviceId, OP_READ_DEVICE_DATA,
                                point.getIndex(), Dnp3Quality.BAD, null);
                    }
                    Dnp3Reading reading = decorate(context, raw);
                    if (cachingEnabled) {
                        cacheIfCurrent(context, epoch, reading);
                    }
                    byIndex.put(point.getIndex(), reading);
                }
            }

            Map<String, Dnp3Reading> readings = new LinkedHashMap<>();
            for (Dnp3DataPoint point : configured) {
                Dnp3Reading reading = byIndex.get(point.getIndex());
                readings.put(point.getSensorType() + "_" + point.getIndex(), reading);
            }

            Instant now = clock.instant();
            context.setLastReadingCount(readings.size());
            context.setLastReadAt(now);
            pointCount = readings.size();
            success = true;
            log.debug("设备数据读取完成: {}, 点位: {}, 缓存命中: {}", deviceId, pointCount, cachedPoints);
            return DeviceReadResult.builder()
                    .deviceId(deviceId)
                    .outstationAddress(context.getDevice().getOutstationAddress())
                    .timestamp(now)
                    .readings(readings)
                    .totalPoints(pointCount)
                    .cachedPoints(cachedPoints)
                    .build();
        } finally {
            recordMetric(OP_READ_DEVICE_DATA, start, success, pointCount);
        }
    }

    /**
     * 写入输出点位，成功后清除该点位缓存
     */
    public void writeDataPoint(String deviceId, int pointIndex, Dnp3DataType dataType, Object value) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            Dnp3DeviceContext context = requireConnected(deviceId, OP_WRITE);
            if (dataType == null || !dataType.isWritable()) {
                throw new WriteException("点位类型不支持写入: " + dataType, deviceId, OP_WRITE, pointIndex);
            }

            Duration timeout = appTimeout(context);
            BiFunction<String, Throwable, DeviceOperationException> failure =
                    (message, cause) -> new WriteException(message, deviceId, OP_WRITE, pointIndex, cause);
            Dnp3Session session = acquireSession(context, OP_WRITE, context.currentEpoch());
            Boolean accepted;
            if (dataType == Dnp3DataType.BINARY_OUTPUT) {
                boolean command = toBoolean(value, deviceId, pointIndex);
                accepted = callDevice(() -> master.writeBinaryOutput(session, pointIndex, command), timeout, failure);
            } else {
                double command = toDouble(value, deviceId, pointIndex);
                accepted = callDevice(() -> master.writeAnalogOutput(session, pointIndex, command), timeout, failure);
            }
            if (!Boolean.TRUE.equals(accepted)) {
                throw new WriteException("外站拒绝写入", deviceId, OP_WRITE, pointIndex);
            }

            dataCache.invalidate(deviceId, pointIndex);
            success = true;
            log.info("点位写入成功: {}[{}] {} = {}", deviceId, pointIndex, dataType.getCode(), value);
        } finally {
            recordMetric(OP_WRITE, start, success, success ? 1 : 0);
        }
    }

    /**
     * 完整性轮询，完成后清除该设备缓存
     */
    public void performIntegrityPoll(String deviceId) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            Dnp3DeviceContext context = requireConnected(deviceId, OP_INTEGRITY_POLL);
            Duration timeout = appTimeout(context);
            Dnp3Session session = acquireSession(context, OP_INTEGRITY_POLL, context.currentEpoch());
            callDevice(() -> {
                master.integrityPoll(session);
                return null;
            }, timeout, readFailure(deviceId, OP_INTEGRITY_POLL, null, timeout));

            int dropped = dataCache.invalidateDevice(deviceId);
            context.setLastPollAt(clock.instant());
            success = true;
            log.info("完整性轮询完成: {}, 清除缓存: {} 条", deviceId, dropped);
        } finally {
            recordMetric(OP_INTEGRITY_POLL, start, success, 0);
        }
    }

    // ==================== 性能与状态 ====================

    public void enablePerformanceOptimizations(boolean caching, boolean bulkOperations) {
        this.cachingEnabled = caching;
        this.bulkOperationsEnabled = bulkOperations;
        if (!caching) {
            dataCache.clear();
        }
        log.info("性能优化设置: 缓存={}, 批量读取={}", caching, bulkOperations);
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public boolean isBulkOperationsEnabled() {
        return bulkOperationsEnabled;
    }

    public Dnp3PerformanceSnapshot getPerformanceMetrics() {
        Map<String, Object> configuration = new LinkedHashMap<>(properties.toSummary());
        configuration.put("cachingEnabled", cachingEnabled);
        configuration.put("bulkOperationsEnabled", bulkOperationsEnabled);
        return Dnp3PerformanceSnapshot.builder()
                .timestamp(clock.instant())
                .operationMetrics(metricsRecorder.allStats())
                .connectionPool(connectionPool.stats())
                .dataCache(dataCache.stats())
                .configuration(configuration)
                .build();
    }

    public Dnp3PerformanceSummary getPerformanceSummary() {
        long windowCount = 0;
        long errors = 0;
        double totalTimeMs = 0;
        for (OperationStats stats : metricsRecorder.allStats().values()) {
            windowCount += stats.getCount();
            errors += stats.getErrors();
            totalTimeMs += stats.getAvgTimeMs() * stats.getCount();
        }

        Map<String, Boolean> optimizations = new LinkedHashMap<>();
        optimizations.put("caching", cachingEnabled);
        optimizations.put("bulkOperations", bulkOperationsEnabled);
        optimizations.put("connectionPooling", true);

        return Dnp3PerformanceSummary.builder()
                .totalOperations(metricsRecorder.totalOperations())
                .averageResponseTimeMs(windowCount > 0 ? totalTimeMs / windowCount : 0.0)
                .successRatePercent(windowCount > 0 ? (windowCount - errors) * 100.0 / windowCount : 0.0)
                .cacheHitRate(dataCache.stats().getHitRate())
                .activeConnections(connectionPool.stats().getActiveCount())
                .connectedDevices(countConnected())
                .performanceOptimizations(optimizations)
                .build();
    }

    /**
     * 设备性能信息，连接信息只查询一次连接池
     */
    public Map<String, Object> getDevicePerformanceStats(String deviceId) {
        Dnp3DeviceContext context = requireDevice(deviceId, "device_performance_stats");
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("deviceId", deviceId);
        stats.put("status", context.getStatus().name());
        stats.put("dataPointCount", context.getDataPoints().size());
        stats.put("cachedPoints", dataCache.indexedPoints(deviceId).size());
        stats.put("lastReadingCount", context.getLastReadingCount());
        stats.put("lastReadAt", context.getLastReadAt());

        Optional<PooledConnection> connection = connectionPool.connectionInfo(deviceId);
        stats.put("pooled", connection.isPresent());
        connection.ifPresent(info -> {
            stats.put("connectionEstablished", info.getEstablishedAt());
            stats.put("connectionLastUsed", info.getLastUsedAt());
            stats.put("connectionExpiresAt", info.getExpiresAt());
            stats.put("connectionUseCount", info.getUseCount());
        });
        return stats;
    }

    public Map<String, Object> getDeviceStatus(String deviceId) {
        Dnp3DeviceContext context = requireDevice(deviceId, "device_status");
        Dnp3Device device = context.getDevice();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("deviceId", deviceId);
        status.put("masterAddress", device.getMasterAddress());
        status.put("outstationAddress", device.getOutstationAddress());
        status.put("host", device.getHost());
        status.put("port", device.getPort());
        status.put("status", context.getStatus().name());
        status.put("connected", context.isConnected());
        status.put("dataPointCount", context.getDataPoints().size());
        status.put("lastReadingCount", context.getLastReadingCount());
        status.put("lastReadAt", context.getLastReadAt());
        status.put("lastPollAt", context.getLastPollAt());
        return status;
    }

    public Map<String, Object> getServiceStatus() {
        Map<String, String> deviceStates = new TreeMap<>();
        devices.forEach((deviceId, context) -> deviceStates.put(deviceId, context.getStatus().name()));

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("protocol", "DNP3");
        status.put("running", running.get());
        status.put("cachingEnabled", cachingEnabled);
        status.put("bulkOperationsEnabled", bulkOperationsEnabled);
        status.put("totalDevices", deviceStates.size());
        status.put("connectedDevices", countConnected());
        status.put("devices", deviceStates);
        return status;
    }

    public void clearPerformanceMetrics() {
        metricsRecorder.reset();
    }

    // ==================== 内部方法 ====================

    private DeviceConnector connectorFor(Dnp3DeviceContext context) {
        Dnp3Device device = context.getDevice();
        Duration timeout = device.getLinkTimeout() != null ? device.getLinkTimeout() : properties.readTimeout();
        return deviceId -> callDevice(() -> master.connect(device), timeout,
                (message, cause) -> new ConnectionException(message, deviceId, OP_CONNECT, cause),
                lateSession -> {
                    log.warn("连接超时后会话才建立，直接关闭: {}", deviceId);
                    lateSession.close();
                });
    }

    /**
     * 设备应用层超时，未配置时使用全局读取超时
     */
    private Duration appTimeout(Dnp3DeviceContext context) {
        Duration timeout = context.getDevice().getAppTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return properties.readTimeout();
        }
        return timeout;
    }

    /**
     * 从连接池获取会话；获取期间设备被断开时释放刚建立的连接
     */
    private Dnp3Session acquireSession(Dnp3DeviceContext context, String operation, long epoch) {
        String deviceId = context.getDeviceId();
        ConnectionHandle handle = connectionPool.getOrCreate(deviceId, connectorFor(context));
        if (context.currentEpoch() != epoch && !context.isConnected()) {
            connectionPool.release(deviceId);
            throw ConnectionException.notConnected(deviceId, operation);
        }
        return (Dnp3Session) handle;
    }

    /**
     * 写入缓存后复核 epoch，期间发生过断开则撤销写入
     */
    private void cacheIfCurrent(Dnp3DeviceContext context, long epoch, Dnp3Reading reading) {
        String deviceId = context.getDeviceId();
        dataCache.put(deviceId, reading.getIndex(), reading);
        if (context.currentEpoch() != epoch) {
            dataCache.invalidate(deviceId, reading.getIndex());
            log.debug("读取期间设备已断开，丢弃缓存: {}:{}", deviceId, reading.getIndex());
        }
    }

    private Map<Integer, Dnp3Reading> readGrouped(Dnp3Session session, String deviceId,
                                                  List<Dnp3DataPoint> points, Duration timeout) {
        Map<Dnp3DataType, List<Dnp3DataPoint>> groups = new EnumMap<>(Dnp3DataType.class);
        for (Dnp3DataPoint point : points) {
            groups.computeIfAbsent(point.getDataType(), k -> new ArrayList<>()).add(point);
        }

        Map<Integer, Dnp3Reading> result = new HashMap<>();
        for (Map.Entry<Dnp3DataType, List<Dnp3DataPoint>> group : groups.entrySet()) {
            Dnp3DataType dataType = group.getKey();
            int first = Integer.MAX_VALUE;
            int last = Integer.MIN_VALUE;
            Set<Integer> wanted = new HashSet<>();
            for (Dnp3DataPoint point : group.getValue()) {
                first = Math.min(first, point.getIndex());
                last = Math.max(last, point.getIndex());
                wanted.add(point.getIndex());
            }
            long span = (long) last - first + 1;
            if (span > Integer.MAX_VALUE) {
                // 区间超出int范围，改为逐点读取
                log.debug("点位区间过大，逐点读取: {} {} [{}, {}]", deviceId, dataType, first, last);
                result.putAll(readEach(session, deviceId, group.getValue(), timeout));
                continue;
            }
            int startIndex = first;
            int count = (int) span;
            List<Dnp3Reading> readings = callDevice(() -> master.readRange(session, dataType, startIndex, count),
                    timeout, readFailure(deviceId, OP_READ_DEVICE_DATA, null, timeout));
            if (readings == null) {
                continue;
            }
            for (Dnp3Reading reading : readings) {
                if (reading != null && wanted.contains(reading.getIndex())) {
                    result.put(reading.getIndex(), reading);
                }
            }
        }
        return result;
    }

    private Map<Integer, Dnp3Reading> readEach(Dnp3Session session, String deviceId,
                                               List<Dnp3DataPoint> points, Duration timeout) {
        Map<Integer, Dnp3Reading> result = new HashMap<>();
        for (Dnp3DataPoint point : points) {
            Dnp3Reading reading = callDevice(
                    () -> master.readPoint(session, point.getDataType(), point.getIndex()),
                    timeout, readFailure(deviceId, OP_READ_DEVICE_DATA, point.getIndex(), timeout));
            if (reading != null) {
                result.put(point.getIndex(), reading);
            }
        }
        return result;
    }

    /**
     * 按点位配置补全类型与描述，模拟量输入换算为工程值
     */
    private Dnp3Reading decorate(Dnp3DeviceContext context, Dnp3Reading raw) {
        Optional<Dnp3DataPoint> config = context.findPoint(raw.getIndex());
        Dnp3Reading.Dnp3ReadingBuilder builder = raw.toBuilder();
        if (raw.getTimestamp() == null) {
            builder.timestamp(clock.instant());
        }
        if (raw.getQuality() == null) {
            builder.quality(Dnp3Quality.GOOD);
        }
        if (config.isPresent()) {
            Dnp3DataPoint point = config.get();
            builder.dataType(point.getDataType())
                    .sensorType(point.getSensorType())
                    .description(point.getDescription())
                    .unit(point.getUnit());
            if (point.isScaled() && raw.getValue() instanceof Number) {
                builder.value(point.toEngineeringValue(((Number) raw.getValue()).doubleValue()));
            }
        }
        return builder.build();
    }

    private <T> T callDevice(Callable<T> call, Duration timeout,
                             BiFunction<String, Throwable, DeviceOperationException> failure) {
        return callDevice(call, timeout, failure, null);
    }

    /**
     * 在IO线程池中执行设备调用并等待结果
     *
     * @param lateResult 超时后仍返回的结果交给它处理；为空时超时即中断调用
     */
    private <T> T callDevice(Callable<T> call, Duration timeout,
                             BiFunction<String, Throwable, DeviceOperationException> failure,
                             Consumer<T> lateResult) {
        ListeningExecutorService executor = this.listeningExecutor;
        if (executor == null || !running.get()) {
            throw failure.apply("DNP3服务未启动", null);
        }

        ListenableFuture<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw failure.apply("协议IO线程池已满", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (lateResult == null) {
                future.cancel(true);
            } else {
                Futures.addCallback(future, new FutureCallback<T>() {
                    @Override
                    public void onSuccess(T result) {
                        if (result != null) {
                            lateResult.accept(result);
                        }
                    }

                    @Override
                    public void onFailure(Throwable t) {
                        log.debug("超时后的设备调用失败: {}", t.getMessage());
                    }
                }, MoreExecutors.directExecutor());
            }
            throw failure.apply("操作超时(" + timeout.toMillis() + "ms)", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure.apply("操作被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DeviceOperationException) {
                throw (DeviceOperationException) cause;
            }
            throw failure.apply("协议调用失败: " + cause.getMessage(), cause);
        }
    }

    private static BiFunction<String, Throwable, DeviceOperationException> readFailure(
            String deviceId, String operation, Integer pointIndex, Duration timeout) {
        return (message, cause) -> {
            if (cause instanceof TimeoutException) {
                log.warn("设备读取超时: {} {} point={} timeout={}ms", deviceId, operation, pointIndex, timeout.toMillis());
                return ReadException.timeout(deviceId, operation, pointIndex, timeout.toMillis());
            }
            if (cause == null) {
                return new ReadException(message, deviceId, operation, pointIndex, Dnp3Quality.COMM_LOST, null);
            }
            log.error("设备读取失败: {} {} point={}", deviceId, operation, pointIndex, cause);
            return ReadException.ioFailure(deviceId, operation, pointIndex, cause);
        };
    }

    private Dnp3DeviceContext requireDevice(String deviceId, String operation) {
        Dnp3DeviceContext context = deviceId == null ? null : devices.get(deviceId);
        if (context == null) {
            throw ConnectionException.notConfigured(deviceId, operation);
        }
        return context;
    }

    private Dnp3DeviceContext requireConnected(String deviceId, String operation) {
        Dnp3DeviceContext context = requireDevice(deviceId, operation);
        if (!context.isConnected()) {
            throw ConnectionException.notConnected(deviceId, operation);
        }
        return context;
    }

    private int countConnected() {
        int connected = 0;
        for (Dnp3DeviceContext context : devices.values()) {
            if (context.isConnected()) {
                connected++;
            }
        }
        return connected;
    }

    /**
     * 记录性能采样，记录失败不影响设备操作
     */
    private void recordMetric(String operation, long startNanos, boolean success, int dataPointCount) {
        try {
            metricsRecorder.record(operation, Duration.ofNanos(System.nanoTime() - startNanos), success, dataPointCount);
        } catch (RuntimeException e) {
            log.warn("记录性能指标失败: {}", operation, e);
        }
    }

    private static boolean toBoolean(Object value, String deviceId, int pointIndex) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text) || "1".equals(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text) || "0".equals(text)) {
                return false;
            }
        }
        throw new WriteException("无法转换为开关量: " + value, deviceId, OP_WRITE, pointIndex);
    }

    private static double toDouble(Object value, String deviceId, int pointIndex) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new WriteException("无法转换为模拟量: " + value, deviceId, OP_WRITE, pointIndex, e);
            }
        }
        throw new WriteException("无法转换为模拟量: " + value, deviceId, OP_WRITE, pointIndex);
    }
}
