package com.drycleaning.interfaces.controller;

import com.drycleaning.application.dto.CustomerAddressRequest;
import com.drycleaning.application.dto.CustomerAddressResponse;
import com.drycleaning.application.service.CustomerAddressService;
import com.drycleaning.domain.entity.AddressType;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AddressController.class)
@DisplayName("AddressController 테스트")
class AddressControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CustomerAddressService customerAddressService;

    private CustomerAddressRequest request(String label) {
        return new CustomerAddressRequest(AddressType.HOME, label, "123 Main St", null, "Springfield", "IL",
                "62701", null, true, null);
    }

    @Test
    @DisplayName("주소를 등록하면 201을 반환한다")
    void createAddress() throws Exception {
        when(customerAddressService.createAddress(eq(10L), any(CustomerAddressRequest.class)))
                .thenReturn(new CustomerAddressResponse(1L, AddressType.HOME, "집", "123 Main St", null,
                        "Springfield", "IL", "62701", "USA", true, null, "123 Main St, Springfield, IL 62701, USA"));

        mockMvc.perform(post("/api/customers/me/addresses")
                        .header("X-Account-Id", 10L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("집"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.addressId").value(1))
                .andExpect(jsonPath("$.defaultAddress").value(true));
    }

    @Test
    @DisplayName("별칭이 비어 있으면 400과 필드 오류를 반환한다")
    void createAddress_BlankLabel() throws Exception {
        mockMvc.perform(post("/api/customers/me/addresses")
                        .header("X-Account-Id", 10L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(" "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field_errors[0].field").value("label"));

        verifyNoInteractions(customerAddressService);
    }

    @Test
    @DisplayName("이미 쓰는 별칭으로 수정하면 409와 DUPLICATE를 반환한다")
    void updateAddress_DuplicateLabel() throws Exception {
        when(customerAddressService.updateAddress(eq(10L), eq(2L), any(CustomerAddressRequest.class)))
                .thenThrow(new BusinessException(ErrorKind.DUPLICATE, "이미 사용 중인 주소 별칭입니다: 집"));

        mockMvc.perform(put("/api/customers/me/addresses/2")
                        .header("X-Account-Id", 10L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("집"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_kind").value("DUPLICATE"));
    }

    @Test
    @DisplayName("주소를 삭제하면 204를 반환한다")
    void deleteAddress() throws Exception {
        mockMvc.perform(delete("/api/customers/me/addresses/2")
                        .header("X-Account-Id", 10L))
                .andExpect(status().isNoContent());

        verify(customerAddressService).deleteAddress(10L, 2L);
    }
}
