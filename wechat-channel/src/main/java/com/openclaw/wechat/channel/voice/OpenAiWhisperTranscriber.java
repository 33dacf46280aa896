package com.openclaw.wechat.channel.voice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.wechat.channel.account.ResolvedAccount.VoiceSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Transcribes through the OpenAI Whisper API after converting the SILK clip
 * to MP3.
 */
@Slf4j
public class OpenAiWhisperTranscriber implements VoiceTranscriber {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    static final String MODEL = "whisper-1";
    static final String API_KEY_ENV = "OPENAI_API_KEY";
    private static final MediaType AUDIO_MPEG = MediaType.parse("audio/mpeg");

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final AudioConverter converter;
    private final Function<String, String> env;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiWhisperTranscriber() {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .build(), DEFAULT_BASE_URL, new FfmpegAudioConverter(), System::getenv);
    }

    public OpenAiWhisperTranscriber(OkHttpClient httpClient, String baseUrl, AudioConverter converter,
            Function<String, String> env) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.converter = converter;
        this.env = env;
    }

    @Override
    public Optional<String> transcribe(Path silkFile, Path workDir, VoiceSettings settings) throws IOException {
        String apiKey = settings.openaiApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = env.apply(API_KEY_ENV);
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI voice transcription requires voice.openaiApiKey or {}", API_KEY_ENV);
            return Optional.empty();
        }

        Path mp3 = workDir.resolve("voice.mp3");
        converter.convert(silkFile, mp3);

        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "voice.mp3", RequestBody.create(mp3.toFile(), AUDIO_MPEG))
                .addFormDataPart("model", MODEL)
                .build();
        Request request = new Request.Builder()
                .url(baseUrl + "/audio/transcriptions")
                .header("Authorization", "Bearer " + apiKey)
                .post(body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.warn("Whisper API error {}: {}", response.code(), payload);
                return Optional.empty();
            }
            WhisperResponse parsed = objectMapper.readValue(payload, WhisperResponse.class);
            if (parsed.getText() == null || parsed.getText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(parsed.getText().trim());
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WhisperResponse {
        private String text;
    }
}
