package com.warehouse;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application against the in-memory store: upload, list, sell until empty.
 */
@SpringBootTest
@AutoConfigureMockMvc
class WarehouseInventoryApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void uploadListAndSell() throws Exception {
        mockMvc.perform(get("/warehouse/v1/health"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/warehouse/v1/inventory").contentType(MediaType.APPLICATION_JSON).content("""
                        {"inventory": [
                          {"art_id": "e2e-1", "name": "leg", "stock": "4"},
                          {"art_id": "e2e-2", "name": "seat", "stock": "1"}]}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("2 item inserted"));

        mockMvc.perform(post("/warehouse/v1/product").contentType(MediaType.APPLICATION_JSON).content("""
                        {"products": [{"name": "e2e stool", "contain_articles": [
                          {"art_id": "e2e-1", "amount_of": "3"},
                          {"art_id": "e2e-2", "amount_of": "1"}]}]}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1 product inserted"));

        mockMvc.perform(get("/warehouse/v1/product"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.product_stocks[?(@.name == 'e2e stool')].available_product_no").value("1"));

        mockMvc.perform(post("/warehouse/v1/product/e2e stool"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/warehouse/v1/product/e2e stool"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/warehouse/v1/product/e2e unknown"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/warehouse/v1/inventory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inventory[?(@.art_id == 'e2e-1')].stock").value("1"))
                .andExpect(jsonPath("$.inventory[?(@.art_id == 'e2e-2')].stock").value("0"));

        mockMvc.perform(post("/warehouse/v1/inventory").contentType(MediaType.APPLICATION_JSON).content("""
                        {"inventory": [{"art_id": "e2e-3", "name": "bolt", "stock": "-2"}]}
                        """))
                .andExpect(status().isBadRequest());
    }
}
