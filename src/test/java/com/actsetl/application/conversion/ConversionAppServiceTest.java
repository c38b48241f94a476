package com.actsetl.application.conversion;

import com.actsetl.application.conversion.exception.InputTooLargeException;
import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.act.model.EditorialNote;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.infrastructure.pipeline.ConversionPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversionAppServiceTest {

    @Mock
    private ConversionPipeline conversionPipeline;

    @InjectMocks
    private ConversionAppService service;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "maxInputBytes", 64L);
    }

    @Test
    void delegates_to_pipeline() {
        ConversionResult expected = new ConversionResult("<akomaNtoso/>", List.of(), List.of());
        when(conversionPipeline.execute("<act/>", List.of())).thenReturn(expected);

        assertThat(service.convert("<act/>")).isSameAs(expected);
    }

    @Test
    void passes_notes_to_pipeline() {
        List<ActNotes> notes = List.of(new ActNotes("/eli/ie/oireachtas/2024/act/12",
                List.of(new EditorialNote("sec_1", "Note.", "editorial"))));
        ConversionResult expected = new ConversionResult("<akomaNtoso/>", List.of(), List.of());
        when(conversionPipeline.execute("<act/>", notes)).thenReturn(expected);

        assertThat(service.convert("<act/>", notes)).isSameAs(expected);
    }

    @Test
    void rejects_oversized_input() {
        String large = "<act>" + "x".repeat(100) + "</act>";

        assertThatThrownBy(() -> service.convert(large))
                .isInstanceOf(InputTooLargeException.class)
                .hasMessageContaining("64");
        verify(conversionPipeline, never()).execute(anyString(), any());
    }
}
