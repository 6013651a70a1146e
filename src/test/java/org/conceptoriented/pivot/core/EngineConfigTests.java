package org.conceptoriented.pivot.core;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class EngineConfigTests {

    @BeforeClass
    public static void setUpClass() {
    }

    @Before
    public void setUp() {
    }

    @Test
    public void defaultsTest()
    {
        EngineConfig config = EngineConfig.defaults();
        assertEquals("|", config.getSeparator());
        assertEquals(1, config.getDiffParallelism());
        assertEquals(FaultPolicy.REPORT, config.getFaultPolicy());
        assertEquals(-1, config.getDefaultExpandDepth());

        // Every call returns an own copy
        config.setSeparator("/");
        assertEquals("|", EngineConfig.defaults().getSeparator());
    }

    @Test
    public void jsonTest() throws DcError
    {
        EngineConfig config = EngineConfig.fromJson("{`separator`:`/`, `faultPolicy`:`abort`}".replace('`', '"'));
        assertEquals("/", config.getSeparator());
        assertEquals(FaultPolicy.ABORT, config.getFaultPolicy());
        assertEquals(1, config.getDiffParallelism());

        EngineConfig copy = EngineConfig.fromJson(config.toJson());
        assertEquals("/", copy.getSeparator());
        assertEquals(FaultPolicy.ABORT, copy.getFaultPolicy());

        try {
            EngineConfig.fromJson("{`diffParallelism`:0}".replace('`', '"'));
            fail("Zero parallelism accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }
        try {
            EngineConfig.fromJson("{`faultPolicy`:`ignore`}".replace('`', '"'));
            fail("Unknown policy accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }
    }
}
