package com.finfact.pipeline.artifact;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.grid.GridNormalizer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlTableExtractor")
class HtmlTableExtractorTest {

    private HtmlTableExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new HtmlTableExtractor(new GridNormalizer(new PipelineProperties()));
    }

    @Test
    void readsDeclaredHeaderAndSurroundingText() {
        String page = """
            # 第十节 财务报告
            ## 合并资产负债表
            单位：元 币种：人民币
            <table><thead><tr><th>项目</th><th>期末余额</th><th>期初余额</th></tr></thead>
            <tbody><tr><td>货币资金</td><td>1,000</td><td>900</td></tr>
            <tr><td>存货</td><td>300</td><td>250</td></tr></tbody></table>
            注：期末余额经审计。
            """;

        List<RawTableCandidate> tables = extractor.extract("mineru", 7, page);

        assertThat(tables).hasSize(1);
        RawTableCandidate table = tables.get(0);
        assertThat(table.engine()).isEqualTo("mineru");
        assertThat(table.pageNumber()).isEqualTo(7);
        assertThat(table.title()).isEqualTo("合并资产负债表");
        assertThat(table.context()).contains("单位：元 币种：人民币").contains("注：期末余额经审计");
        assertThat(table.grid().headerRowCount()).isEqualTo(1);
        assertThat(table.grid().columnLabels()).containsExactly("项目", "期末余额", "期初余额");
        assertThat(table.grid().dataRows()).containsExactly(
            List.of("货币资金", "1,000", "900"),
            List.of("存货", "300", "250")
        );
    }

    @Test
    void expandsSpansAndInfersHeaders() {
        String page = "<table>"
            + "<tr><td rowspan=\"2\">项目</td><td colspan=\"2\">2023年</td></tr>"
            + "<tr><td>本期</td><td>上期</td></tr>"
            + "<tr><td>营业收入</td><td>100</td><td>90</td></tr>"
            + "</table>";

        RawTableCandidate table = extractor.extract("docling", 1, page).get(0);

        assertThat(table.grid().columnLabels()).containsExactly("项目", "2023年/本期", "2023年/上期");
        assertThat(table.grid().dataRows()).containsExactly(List.of("营业收入", "100", "90"));
    }

    @Test
    void everyTableOnThePageIsExtracted() {
        String page = """
            利润表
            <table><tr><td>营业收入</td><td>1</td></tr></table>
            现金流量表
            <table><tr><td>经营活动产生的现金流量净额</td><td>2</td></tr></table>
            """;

        List<RawTableCandidate> tables = extractor.extract("mineru", 3, page);

        assertThat(tables).extracting(RawTableCandidate::title).containsExactly("利润表", "现金流量表");
    }

    @Test
    void pageWithoutTablesYieldsNothing() {
        assertThat(extractor.extract("mineru", 1, "# 重要提示\n本公司董事会保证报告内容真实。")).isEmpty();
        assertThat(extractor.extract("mineru", 1, null)).isEmpty();
    }

    @Test
    void lastHeadingPrefersMarkdownHeadingOverShortLine() {
        assertThat(HtmlTableExtractor.lastHeading("## 母公司利润表\n单位：元\n")).isEqualTo("母公司利润表");
        assertThat(HtmlTableExtractor.lastHeading("一些说明\n合并现金流量表\n")).isEqualTo("合并现金流量表");
    }
}
