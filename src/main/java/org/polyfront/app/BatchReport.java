package org.polyfront.app;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.polyfront.core.Configuration;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Coverage of a batch run: which units made it through parsing and lowering,
 * where the others stopped, and how many source lines were lost.
 */
public class BatchReport {

    /**
     * Outcome of one unit. failureKind, failureMessage and failureInfo are null
     * for a unit that passed.
     */
    public record UnitReport(String fileName, int totalLines, int failedLines,
                             String failureKind, String failureMessage, SourceInfo failureInfo) {

        public boolean passed() {
            return failureKind == null;
        }
    }

    private final List<UnitReport> units = new ArrayList<>();

    void add(UnitReport unit) {
        units.add(unit);
    }

    public List<UnitReport> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public int passedCount() {
        return (int) units.stream().filter(UnitReport::passed).count();
    }

    public int failedCount() {
        return units.size() - passedCount();
    }

    public int totalLines() {
        return units.stream().mapToInt(UnitReport::totalLines).sum();
    }

    public int failedLines() {
        return units.stream().mapToInt(UnitReport::failedLines).sum();
    }

    /**
     * @return failed lines over total lines, 0 for a batch without lines
     */
    public double failedLineFraction() {
        int total = totalLines();
        return total == 0 ? 0.0 : (double) failedLines() / total;
    }

    public String toJson() {
        JSONArray array = new JSONArray();
        for (UnitReport unit : units) {
            JSONObject json = new JSONObject();
            json.put("file", unit.fileName());
            json.put("passed", unit.passed());
            json.put("lines", unit.totalLines());
            json.put("failedLines", unit.failedLines());
            if (!unit.passed()) {
                json.put("kind", unit.failureKind());
                json.put("message", unit.failureMessage());
                SourceInfo info = unit.failureInfo();
                if (info != null && !info.isFake()) {
                    json.put("line", info.line);
                    json.put("column", info.column);
                }
            }
            array.add(json);
        }
        JSONObject report = new JSONObject();
        report.put("generator", Configuration.getVersionString());
        report.put("astVersion", Configuration.genericAstVersion);
        report.put("units", array);
        report.put("passed", passedCount());
        report.put("failed", failedCount());
        report.put("totalLines", totalLines());
        report.put("failedLines", failedLines());
        report.put("failedLineFraction", failedLineFraction());
        return JSON.toJSONString(report, JSONWriter.Feature.PrettyFormat);
    }

    @Override
    public String toString() {
        return "BatchReport{units=" + units.size() + ", passed=" + passedCount() + ", failedLines="
                + failedLines() + "/" + totalLines() + "}";
    }
}
