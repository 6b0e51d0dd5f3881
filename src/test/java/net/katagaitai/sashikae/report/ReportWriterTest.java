package net.katagaitai.sashikae.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import net.katagaitai.sashikae.analysis.SlotInfo;
import net.katagaitai.sashikae.diff.DiffResult;
import net.katagaitai.sashikae.model.Function;
import net.katagaitai.sashikae.model.type.ElementaryType;
import net.katagaitai.sashikae.model.variable.StateVariable;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.math.BigInteger;
import java.util.Collections;

import static org.junit.Assert.*;

public class ReportWriterTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static DiffReport newReport(SlotInfo slot) {
        DiffResult result = new DiffResult(
                Lists.newArrayList(new StateVariable("legacy", ElementaryType.UINT256)),
                Lists.newArrayList(new StateVariable("paused", ElementaryType.BOOL)),
                Lists.newArrayList(new StateVariable("balance", ElementaryType.UINT256)),
                Lists.newArrayList(new Function("pause", "pause()")),
                Lists.newArrayList(new Function("withdraw", "withdraw(uint256)")),
                Collections.emptyList());
        return new DiffReport("VaultV1", "VaultV2", result, slot);
    }

    @Test
    public void test_toJson() throws Exception {
        ReportWriter writer = new ReportWriter(folder.getRoot());
        JsonNode json = new ObjectMapper().readTree(writer.toJson(newReport(null)));
        assertEquals("VaultV1_VaultV2", json.get("name").asText());
        assertEquals("legacy", json.get("missingVariables").get(0).asText());
        assertEquals("paused", json.get("newVariables").get(0).asText());
        assertEquals("balance", json.get("taintedVariables").get(0).asText());
        assertEquals("pause()", json.get("newFunctions").get(0).asText());
        assertEquals("withdraw(uint256)", json.get("modifiedFunctions").get(0).asText());
        assertEquals(0, json.get("taintedFunctions").size());
        assertFalse(json.has("implementationSlot"));
    }

    @Test
    public void test_toJsonでスロット() throws Exception {
        SlotInfo slot = new SlotInfo("implementation", "address", BigInteger.valueOf(3), 160, 0);
        JsonNode json = new ObjectMapper().readTree(new ReportWriter(folder.getRoot()).toJson(newReport(slot)));
        JsonNode node = json.get("implementationSlot");
        assertEquals("implementation", node.get("name").asText());
        assertEquals(3, node.get("slot").asInt());
        assertEquals(160, node.get("size").asInt());
    }

    @Test
    public void test_save() throws Exception {
        File dir = new File(folder.getRoot(), "result");
        ReportWriter writer = new ReportWriter(dir);
        DiffReport report = newReport(null);
        File file = writer.save(report);
        assertTrue(file.exists());
        assertEquals(new File(dir, "VaultV1_VaultV2.json"), file);
        JsonNode json = new ObjectMapper().readTree(file);
        assertEquals("withdraw(uint256)", json.get("modifiedFunctions").get(0).asText());
    }

    @Test(expected = ReportException.class)
    public void test_saveでディレクトリを作れない() throws Exception {
        File notDir = folder.newFile("file");
        new ReportWriter(new File(notDir, "result")).save(newReport(null));
    }
}
