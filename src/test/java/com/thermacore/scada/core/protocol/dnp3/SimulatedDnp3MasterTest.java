package com.thermacore.scada.core.protocol.dnp3;

import com.thermacore.scada.common.domain.enums.Dnp3DataType;
import com.thermacore.scada.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedDnp3MasterTest {

    private MutableClock clock;
    private SimulatedDnp3Master master;
    private Dnp3Session session;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        master = new SimulatedDnp3Master(clock);
        session = master.connect(Dnp3Device.builder().deviceId("D1").outstationAddress(10).host("127.0.0.1").build());
    }

    @Test
    void analogValuesFollowIndexBands() {
        for (int i = 0; i < 50; i++) {
            double temperature = (Double) master.readPoint(session, Dnp3DataType.ANALOG_INPUT, 3).getValue();
            double pressure = (Double) master.readPoint(session, Dnp3DataType.ANALOG_INPUT, 15).getValue();
            double flow = (Double) master.readPoint(session, Dnp3DataType.ANALOG_INPUT, 25).getValue();
            double other = (Double) master.readPoint(session, Dnp3DataType.ANALOG_INPUT, 40).getValue();
            assertTrue(temperature >= 20.0 && temperature < 80.0);
            assertTrue(pressure >= 0.0 && pressure < 150.0);
            assertTrue(flow >= 0.0 && flow < 100.0);
            assertTrue(other >= 0.0 && other < 1000.0);
        }
    }

    @Test
    void rangeReadReturnsConsecutiveIndices() {
        List<Dnp3Reading> readings = master.readRange(session, Dnp3DataType.COUNTER, 4, 3);

        assertEquals(3, readings.size());
        assertEquals(4, readings.get(0).getIndex());
        assertEquals(6, readings.get(2).getIndex());
        assertInstanceOf(Long.class, readings.get(1).getValue());
        assertEquals(clock.instant(), readings.get(0).getTimestamp());
    }

    @Test
    void rangeReadEndingAtMaxIndexStops() {
        List<Dnp3Reading> readings = master.readRange(session, Dnp3DataType.COUNTER, Integer.MAX_VALUE - 1, 2);

        assertEquals(2, readings.size());
        assertEquals(Integer.MAX_VALUE, readings.get(1).getIndex());
    }

    @Test
    void writtenOutputsAreReadBack() {
        assertTrue(master.writeAnalogOutput(session, 2, 42.5));
        assertTrue(master.writeBinaryOutput(session, 3, true));

        assertEquals(42.5, master.readPoint(session, Dnp3DataType.ANALOG_OUTPUT, 2).getValue());
        assertEquals(true, master.readPoint(session, Dnp3DataType.BINARY_OUTPUT, 3).getValue());
    }

    @Test
    void closedSessionIsRejected() {
        session.close();

        assertThrows(IllegalStateException.class,
                () -> master.readPoint(session, Dnp3DataType.BINARY_INPUT, 0));
        assertThrows(IllegalStateException.class, () -> master.integrityPoll(session));
    }
}
