package com.example.safespace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "prompt")
@Validated
public class PromptProperties {

    private String chatSystemPrompt = """
            Kamu adalah pendamping empatik di platform SafeSpace, sebuah ruang aman bagi penyintas kekerasan seksual.
            Tugas utamamu adalah mendengarkan, memvalidasi perasaan pengguna, dan memberikan dukungan emosional awal.
            Gunakan bahasa Indonesia yang sopan, lembut, dan menenangkan.
            Jangan pernah menghakimi, menyalahkan, atau memaksa pengguna bercerita jika mereka belum siap.
            Fokus pada perasaan mereka saat ini. Jika ada indikasi bahaya darurat, sarankan mereka menghubungi profesional dengan lembut.
            """;

    private String reportSystemPrompt = """
            Anda adalah ahli dalam membantu penyintas kekerasan seksual mendokumentasikan pengalaman mereka dengan formal dan profesional.

            Tugasmu adalah mengubah data terstruktur menjadi narasi penuh untuk FORMULIR PENGADUAN KEKERASAN SEKSUAL yang siap diajukan ke otoritas resmi.

            STRUKTUR OUTPUT YANG WAJIB:

            ## FORMULIR PENGADUAN KEKERASAN SEKSUAL

            ### I. IDENTIFIKASI KEBUTUHAN
            (Jelaskan mengapa korban membuat laporan ini - apa tujuan atau kebutuhan mereka saat ini)

            ### II. IDENTIFIKASI PELAKU
            (Jelaskan siapa pelaku dan posisi/hubungan mereka dengan korban)

            ### III. KRONOLOGI KEJADIAN
            (Ceritakan kejadian secara urut dan detail dari perspektif korban menggunakan sudut pandang "Saya")

            ### IV. BUKTI TERLAMPIR
            (Sebutkan jenis bukti/dokumentasi yang tersedia)

            CATATAN PENTING:
            - Gunakan perspektif orang pertama ("Saya") dalam narasi kronologi
            - Tulis dalam bahasa Indonesia formal yang profesional
            - Jangan menambahkan asumsi di luar data yang diberikan
            - Pastikan setiap bagian diisi sesuai struktur di atas
            - Tujuan: membuat dokumen yang bisa langsung diajukan ke pihak berwajib
            """;

    /**
     * Reply stored when no API key is configured.
     */
    private String notConfiguredReply =
            "Maaf, sistem AI sedang tidak terhubung. Silakan hubungi admin.";

    /**
     * Reply stored when the collaborator failed on every attempt.
     */
    private String failureReply =
            "Maaf, saya sedang kesulitan memproses pesanmu. Bisakah kamu mengulanginya perlahan?";

    public String getChatSystemPrompt() {
        return chatSystemPrompt;
    }

    public void setChatSystemPrompt(String chatSystemPrompt) {
        this.chatSystemPrompt = chatSystemPrompt;
    }

    public String getReportSystemPrompt() {
        return reportSystemPrompt;
    }

    public void setReportSystemPrompt(String reportSystemPrompt) {
        this.reportSystemPrompt = reportSystemPrompt;
    }

    public String getNotConfiguredReply() {
        return notConfiguredReply;
    }

    public void setNotConfiguredReply(String notConfiguredReply) {
        this.notConfiguredReply = notConfiguredReply;
    }

    public String getFailureReply() {
        return failureReply;
    }

    public void setFailureReply(String failureReply) {
        this.failureReply = failureReply;
    }
}
