package io.billsync.ledger;

import io.billsync.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerExtractorTest {
    private static final Charset GBK = Charset.forName("GBK");
    private static final String BATCH = "240101_000000";

    private static final String EXPORT = String.join("\r\n",
            "支付宝交易记录明细查询",
            "账号:[someone@example.com]",
            "起始日期:[2024-01-01 00:00:00]    终止日期:[2024-02-01 00:00:00]",
            "---------------------------------交易记录明细列表------------------------------------",
            "交易号,商家订单号,交易创建时间,付款时间,最近修改时间,交易来源地,类型,交易对方,商品名称,金额（元）,收/支,交易状态",
            "12345678,a,b,2024-01-02 10:00:00,e,f,g,h,memoX,100.50,支出",
            "2024010322001,T1,2024-01-03 09:00:00,2024-01-03 09:00:01,2024-01-03 09:00:01,其他,即时到账交易,张三,红包,8.88,收入,交易成功",
            "2024010422001,T2,2024-01-04 09:00:00,2024-01-04 09:00:01,2024-01-04 09:00:01,其他,即时到账交易,余额宝,转入,50.00,,交易成功",
            "",
            "------------------------------------------------------------------------------------",
            "共3笔记录",
            "");

    @Test
    void extractsIncomeAndExpenseRowsFromExport() {
        Metrics metrics = Metrics.detached();
        LedgerExtractor extractor = new LedgerExtractor(new LedgerDecoder(), metrics);

        List<LedgerRow> rows = extractor.extract(new ByteArrayInputStream(EXPORT.getBytes(GBK)), BATCH);

        assertEquals(2, rows.size());
        assertEquals(new LedgerRow("12345678", "2024-01-02 10:00:00", "100.50", "memoX",
                TransactionKind.EXPENSE, "alipay", BATCH), rows.get(0));
        LedgerRow income = rows.get(1);
        assertEquals("2024010322001", income.uniqueId());
        assertEquals("2024-01-03 09:00:01", income.occurredAt());
        assertEquals("红包", income.memo());
        assertEquals("8.88", income.amount());
        assertEquals(TransactionKind.INCOME, income.kind());

        assertEquals(1, metrics.count("ledger.decode.strict"));
        assertEquals(7, metrics.count("ledger.lines.skipped"));
        assertEquals(1, metrics.count("ledger.rows.filtered"));
        assertEquals(2, metrics.count("ledger.rows.kept"));
    }

    @Test
    void dropsLinesWithoutEightDigitPrefix() {
        LedgerExtractor extractor = new LedgerExtractor();
        String text = String.join("\n",
                "1234567,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出",
                "x12345678,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出",
                "１２３４５６７８,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出",
                "   87654321,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,收入   ");

        List<LedgerRow> rows = extractor.extract(text, BATCH);

        assertEquals(1, rows.size());
        assertEquals("87654321", rows.get(0).uniqueId());
        assertEquals(TransactionKind.INCOME, rows.get(0).kind());
    }

    @Test
    void dropsLinesWithFewerThanElevenColumns() {
        LedgerExtractor extractor = new LedgerExtractor();
        String text = String.join("\n",
                "12345678,a,b,2024-01-02 10:00:00,e,f,g,h,m,支出",
                "12345679,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出");

        List<LedgerRow> rows = extractor.extract(text, BATCH);

        assertEquals(1, rows.size());
        assertEquals("12345679", rows.get(0).uniqueId());
    }

    @Test
    void trailingEmptyColumnsStillCount() {
        // kind column is the last one and empty: 11 columns, filtered by kind rather than column count
        Metrics metrics = Metrics.detached();
        LedgerExtractor extractor = new LedgerExtractor(new LedgerDecoder(), metrics);

        List<LedgerRow> rows = extractor.extract("12345678,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,", BATCH);

        assertTrue(rows.isEmpty());
        assertEquals(0, metrics.count("ledger.lines.short"));
        assertEquals(1, metrics.count("ledger.rows.filtered"));
    }

    @Test
    void keepsOnlyRecognizedKinds() {
        LedgerExtractor extractor = new LedgerExtractor();
        String text = String.join("\n",
                "10000001,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出",
                "10000002,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,收入",
                "10000003,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,不计收支",
                "10000004,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00, ",
                "10000005,a,b,2024-01-02 10:00:00,e,f,g,h,m,1.00,支出 extra");

        List<LedgerRow> rows = extractor.extract(text, BATCH);

        assertEquals(List.of("10000001", "10000002"), rows.stream().map(LedgerRow::uniqueId).toList());
        for (LedgerRow r : rows) {
            assertNotNull(r.kind());
            assertEquals("alipay", r.source());
            assertEquals(BATCH, r.batchNumber());
        }
    }

    @Test
    void fieldsAreTrimmed() {
        LedgerExtractor extractor = new LedgerExtractor();
        List<LedgerRow> rows = extractor.extract(
                "12345678 , a , b , 2024-01-02 10:00:00 ,e,f,g,h,  memo  ,  3.20 , 支出 ", BATCH);

        assertEquals(1, rows.size());
        LedgerRow r = rows.get(0);
        assertEquals("12345678", r.uniqueId());
        assertEquals("2024-01-02 10:00:00", r.occurredAt());
        assertEquals("memo", r.memo());
        assertEquals("3.20", r.amount());
    }

    @Test
    void utf8ExportWithInvalidBytesFallsBackToLossyDecoding() {
        Metrics metrics = Metrics.detached();
        LedgerExtractor extractor = new LedgerExtractor(new LedgerDecoder(), metrics);
        byte[] line = "12345678,a,b,2024-01-02 10:00:00,e,f,g,h,memoX,100.50,支出\n".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[line.length + 1];
        data[0] = (byte) 0xFF;
        System.arraycopy(line, 0, data, 1, line.length);

        List<LedgerRow> rows = extractor.extract(new ByteArrayInputStream(data), BATCH);

        assertEquals(1, rows.size());
        assertEquals("12345678", rows.get(0).uniqueId());
        assertEquals(TransactionKind.EXPENSE, rows.get(0).kind());
        assertEquals(1, metrics.count("ledger.decode.lossy"));
    }

    @Test
    void unreadableStreamRaisesDecodeException() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };
        LedgerDecodeException e = assertThrows(LedgerDecodeException.class,
                () -> new LedgerExtractor().extract(broken, BATCH));
        assertEquals("disk gone", e.getCause().getMessage());
    }
}
